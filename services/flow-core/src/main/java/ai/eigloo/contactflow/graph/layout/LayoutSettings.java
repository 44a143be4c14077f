package ai.eigloo.contactflow.graph.layout;

/**
 * Grid geometry used by {@link LayoutEngine}.
 *
 * @param startX x of the first column
 * @param startY y of the first row
 * @param columnSpacing distance between column left edges
 * @param rowSpacing distance between row top edges
 */
public record LayoutSettings(int startX, int startY, int columnSpacing, int rowSpacing) {

    public static final int DEFAULT_START_X = 150;
    public static final int DEFAULT_START_Y = 50;
    public static final int DEFAULT_COLUMN_SPACING = 280;
    public static final int DEFAULT_ROW_SPACING = 180;

    public LayoutSettings {
        if (columnSpacing <= 0 || rowSpacing <= 0) {
            throw new IllegalArgumentException("Layout spacing must be greater than 0");
        }
    }

    public static LayoutSettings defaults() {
        return new LayoutSettings(DEFAULT_START_X, DEFAULT_START_Y, DEFAULT_COLUMN_SPACING, DEFAULT_ROW_SPACING);
    }
}
