package org.pragmatica.ddmm.cli;

import org.pragmatica.ddmm.Ddmm;
import picocli.CommandLine.Command;

@Command(name = "show",
    aliases = "to-python",
    mixinStandardHelpOptions = true,
    description = "Print the source with keywords replaced by brackets.")
class ShowCommand extends RewriteCommand {
    @Override
    protected String rewrite(String text) {
        return Ddmm.transform(text);
    }
}
