package ai.pipestream.filevault;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Main entry point for the FileVault node agent.
 * Serves atomic object upload, download, delete and health over gRPC.
 */
@QuarkusMain
@ApplicationScoped
public class FileVaultNodeApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(FileVaultNodeApplication.class);

    public static void main(String... args) {
        Quarkus.run(FileVaultNodeApplication.class, args);
    }

    @Override
    public int run(String... args) throws Exception {
        LOG.info("FileVault node agent started, waiting for gRPC traffic");
        Quarkus.waitForExit();
        return 0;
    }
}
