package nginxconf.model;

public enum LineType {
    COMMENT("Comment"),
    INCLUDE("Include"),
    DIRECTIVE("Directive"),
    BLOCK("BlockStart");

    private final String label;

    LineType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
