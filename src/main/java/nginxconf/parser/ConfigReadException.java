package nginxconf.parser;

import java.io.IOException;
import java.nio.file.Path;

public class ConfigReadException extends RuntimeException {

    private final transient Path path;

    public ConfigReadException(Path path, IOException cause) {
        super("Failed to read configuration file " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
