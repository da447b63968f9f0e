package nginxconf.model;

import lombok.Value;

import java.util.List;

/**
 * Parsed configuration: the root block plus the identifier of the source it was read from.
 */
@Value
public class NginxConfig {

    Block rootBlock;
    String filePath;
    List<ParseWarning> warnings;

    public NginxConfig(Block rootBlock, String filePath, List<ParseWarning> warnings) {
        this.rootBlock = rootBlock;
        this.filePath = filePath;
        this.warnings = List.copyOf(warnings);
    }

    public NginxConfig(Block rootBlock, String filePath) {
        this(rootBlock, filePath, List.of());
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
