package org.pragmatica.ddmm.cli;

import org.pragmatica.ddmm.Ddmm;
import picocli.CommandLine.Command;

@Command(name = "convert",
    mixinStandardHelpOptions = true,
    description = "Print plain bracket source converted to keyword form.")
class ConvertCommand extends RewriteCommand {
    @Override
    protected String rewrite(String text) {
        return Ddmm.reverseTransform(text);
    }
}
