package work.lcod.html2wt.cli;

import picocli.CommandLine;
import work.lcod.html2wt.api.SerializerOptions;

/**
 * Version banner followed by the built-in serializer defaults.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        var version = Main.class.getPackage().getImplementationVersion();
        var defaults = SerializerOptions.defaults();
        return new String[] {
            "lcod-html2wt (java) " + (version != null ? version : "development"),
            "defaults: maxNewlines=" + defaults.maxNewlines()
                + ", selser=" + defaults.selser()
                + ", rtTestMode=" + defaults.rtTestMode()
                + ", logLevel=" + defaults.logLevel()
        };
    }
}
