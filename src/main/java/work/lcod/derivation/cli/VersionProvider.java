package work.lcod.derivation.cli;

import java.util.TreeSet;
import picocli.CommandLine;
import work.lcod.derivation.runtime.OperationRegistry;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        var operations = new TreeSet<>(OperationRegistry.standard().entries().keySet());
        return new String[] {
            "lcod-derive (java) " + version,
            "operations: " + String.join(", ", operations)
        };
    }
}
