package ai.eigloo.contactflow.composer.config;

import ai.eigloo.contactflow.graph.layout.LayoutSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configures layout geometry, output formatting and block validation for the
 * flow composer.
 */
@ConfigurationProperties(prefix = "contactflow")
public class FlowComposerProperties {

    private final Layout layout = new Layout();
    private final Compiler compiler = new Compiler();
    private final Validation validation = new Validation();

    public Layout getLayout() {
        return layout;
    }

    public Compiler getCompiler() {
        return compiler;
    }

    public Validation getValidation() {
        return validation;
    }

    public static class Layout {

        private int startX = LayoutSettings.DEFAULT_START_X;
        private int startY = LayoutSettings.DEFAULT_START_Y;
        private int columnSpacing = LayoutSettings.DEFAULT_COLUMN_SPACING;
        private int rowSpacing = LayoutSettings.DEFAULT_ROW_SPACING;

        public int getStartX() {
            return startX;
        }

        public void setStartX(int startX) {
            this.startX = startX;
        }

        public int getStartY() {
            return startY;
        }

        public void setStartY(int startY) {
            this.startY = startY;
        }

        public int getColumnSpacing() {
            return columnSpacing;
        }

        public void setColumnSpacing(int columnSpacing) {
            this.columnSpacing = columnSpacing;
        }

        public int getRowSpacing() {
            return rowSpacing;
        }

        public void setRowSpacing(int rowSpacing) {
            this.rowSpacing = rowSpacing;
        }

        public LayoutSettings toSettings() {
            return new LayoutSettings(startX, startY, columnSpacing, rowSpacing);
        }
    }

    public static class Compiler {

        private boolean prettyPrint = true;

        public boolean isPrettyPrint() {
            return prettyPrint;
        }

        public void setPrettyPrint(boolean prettyPrint) {
            this.prettyPrint = prettyPrint;
        }
    }

    public static class Validation {

        /**
         * Parameter keys every block of a given type must carry, keyed by type tag.
         */
        private Map<String, List<String>> requiredParameters = new LinkedHashMap<>();

        public Map<String, List<String>> getRequiredParameters() {
            return requiredParameters;
        }

        public void setRequiredParameters(Map<String, List<String>> requiredParameters) {
            this.requiredParameters = requiredParameters;
        }
    }
}
