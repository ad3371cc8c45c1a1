package org.kconfig4j.frontend.preprocessor.features.probe;

import org.kconfig4j.frontend.preprocessor.IMacroFunction;
import org.kconfig4j.frontend.preprocessor.PreProcessorContext;

import java.util.List;

/**
 * {@code $(cc-option,flags)}, {@code $(as-option,flags)}, {@code $(as-instr,instr)},
 * {@code $(ld-option,flags)} and {@code $(rustc-option,flags)}: {@code y} if the toolchain
 * accepts the argument, otherwise {@code n}.
 */
public class ToolchainProbeFunction implements IMacroFunction {

    private final ToolchainProbe probe;

    public ToolchainProbeFunction(ToolchainProbe probe) {
        this.probe = probe;
    }

    @Override
    public String invoke(PreProcessorContext context, List<String> args) {
        String argument = args.get(0);
        return ProbeRunner.succeeds(context, probe, ToolchainProbe.splitWords(argument), argument) ? "y" : "n";
    }
}
