package org.kconfig4j.cli.commands;

import static org.kconfig4j.KconfigFixtures.lines;

/**
 * Kconfig trees shared by the command tests.
 */
final class CommandTrees {

    static final String SAMPLE = lines(
            "mainmenu \"Sample\"",
            "",
            "config MODULES",
            "\tbool \"modules\"",
            "\toption modules",
            "",
            "config NET",
            "\tbool \"networking\"",
            "",
            "config DRIVER",
            "\ttristate \"driver\"",
            "\tdepends on NET",
            "",
            "config LEVEL",
            "\tint \"level\"",
            "\trange 1 5",
            "\tdefault 2",
            "",
            "config NAME",
            "\tstring \"name\"",
            "\tdefault \"x\"",
            "",
            "choice",
            "\tprompt \"mode\"",
            "",
            "config FAST",
            "\tbool \"fast\"",
            "",
            "config SAFE",
            "\tbool \"safe\"",
            "",
            "endchoice",
            "",
            "config EARLY",
            "\tbool \"early\"",
            "\toption allnoconfig_y");

    private CommandTrees() {}
}
