package me.tavon.omnidock.stream.chat;

public final class DisplayAttributes {

    private final String label;
    private final String color;
    private final boolean labelHidden;

    public DisplayAttributes(String label, String color, boolean labelHidden) {
        this.label = label;
        this.color = color;
        this.labelHidden = labelHidden;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Hex color, {@code #rrggbb}.
     */
    public String getColor() {
        return color;
    }

    public boolean isLabelHidden() {
        return labelHidden;
    }

    @Override
    public String toString() {
        return "DisplayAttributes{label='" + label + "', color='" + color + "', labelHidden=" + labelHidden + '}';
    }
}
