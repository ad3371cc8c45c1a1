package org.kconfig4j.frontend.preprocessor.features.probe;

import org.kconfig4j.frontend.preprocessor.PreProcessorContext;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The toolchain capability probes. Each one runs a tool directly, without a shell, and
 * succeeds when the tool exits with status 0.
 */
public enum ToolchainProbe {

    /** Does the C compiler accept the flags? */
    CC_OPTION("cc-option", "CC", "cc") {
        @Override
        List<String> arguments(List<String> flags, Path scratch) {
            List<String> argv = new ArrayList<>();
            argv.add("-Werror");
            argv.addAll(flags);
            argv.addAll(List.of("-c", "-x", "c", "/dev/null", "-o", scratch.resolve("tmp.o").toString()));
            return argv;
        }
    },

    /** Does the assembler (through the C compiler driver) accept the flags? */
    AS_OPTION("as-option", "CC", "cc") {
        @Override
        List<String> arguments(List<String> flags, Path scratch) {
            List<String> argv = new ArrayList<>(flags);
            argv.addAll(List.of("-c", "-x", "assembler", "/dev/null", "-o", "/dev/null"));
            return argv;
        }
    },

    /** Does the assembler accept the instruction? The instruction is fed on standard input. */
    AS_INSTR("as-instr", "CC", "cc") {
        @Override
        List<String> arguments(List<String> flags, Path scratch) {
            return List.of("-c", "-x", "assembler", "-o", "/dev/null", "-");
        }

        @Override
        String stdin(String argument) {
            return argument.replace("\\n", "\n").replace("\\t", "\t") + "\n";
        }
    },

    /** Does the linker accept the flags? */
    LD_OPTION("ld-option", "LD", "ld") {
        @Override
        List<String> arguments(List<String> flags, Path scratch) {
            List<String> argv = new ArrayList<>();
            argv.add("-v");
            argv.addAll(flags);
            return argv;
        }
    },

    /** Does the Rust compiler accept the flags? */
    RUSTC_OPTION("rustc-option", "RUSTC", "rustc") {
        @Override
        List<String> arguments(List<String> flags, Path scratch) {
            List<String> argv = new ArrayList<>(flags);
            argv.addAll(List.of("--crate-type=rlib", "/dev/null", "--out-dir=" + scratch,
                    "-o", scratch.resolve("tmp.rlib").toString()));
            return argv;
        }
    };

    private final String functionName;
    private final String toolVariable;
    private final String defaultTool;

    ToolchainProbe(String functionName, String toolVariable, String defaultTool) {
        this.functionName = functionName;
        this.toolVariable = toolVariable;
        this.defaultTool = defaultTool;
    }

    public String functionName() {
        return functionName;
    }

    /**
     * @param flags   The probed flags, split on whitespace.
     * @param scratch A temporary directory for output files.
     * @return The tool's arguments, without the tool itself.
     */
    abstract List<String> arguments(List<String> flags, Path scratch);

    /**
     * @return Standard input for the tool, or {@code null}.
     */
    String stdin(String argument) {
        return null;
    }

    /**
     * @return The tool command line from the environment (e.g. {@code CC="ccache gcc"}), split on whitespace.
     */
    List<String> tool(PreProcessorContext context) {
        String tool = context.getHost().environment().get(toolVariable)
                .filter(s -> !s.isBlank())
                .orElse(defaultTool);
        return splitWords(tool);
    }

    static List<String> splitWords(String text) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? List.of() : Arrays.asList(trimmed.split("\\s+"));
    }
}
