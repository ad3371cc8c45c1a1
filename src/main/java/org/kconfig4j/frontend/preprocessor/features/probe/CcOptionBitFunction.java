package org.kconfig4j.frontend.preprocessor.features.probe;

import org.kconfig4j.frontend.preprocessor.IMacroFunction;
import org.kconfig4j.frontend.preprocessor.PreProcessorContext;

import java.util.List;

/**
 * {@code $(cc-option-bit,flag)}: the flag itself if the C compiler accepts it, otherwise empty.
 */
public class CcOptionBitFunction implements IMacroFunction {

    @Override
    public String invoke(PreProcessorContext context, List<String> args) {
        String flag = args.get(0);
        return ProbeRunner.succeeds(context, ToolchainProbe.CC_OPTION, ToolchainProbe.splitWords(flag), flag) ? flag : "";
    }
}
