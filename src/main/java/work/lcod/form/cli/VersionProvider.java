package work.lcod.form.cli;

import picocli.CommandLine;
import work.lcod.form.model.FormMetadata;

/** Engine build plus the form format it writes. */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String build = FormEngineVersion.current();
        return new String[] {
            "markform (java) " + build,
            "form format " + FormMetadata.DEFAULT_SPEC_VERSION
        };
    }

    private static final class FormEngineVersion {
        private FormEngineVersion() {}

        static String current() {
            String implementationVersion = Main.class.getPackage().getImplementationVersion();
            return implementationVersion != null ? implementationVersion : "development";
        }
    }
}
