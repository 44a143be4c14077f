package ai.eigloo.contactflow.graph.wire;

import java.util.Set;

/**
 * Field names of the contact flow wire document.
 *
 * <p>These strings are the compatibility surface with the external routing
 * engine and must not change.</p>
 */
public final class WireFields {

    public static final String DEFAULT_VERSION = "2019-10-30";

    // document
    public static final String VERSION = "Version";
    public static final String NAME = "Name";
    public static final String DESCRIPTION = "Description";
    public static final String START_ACTION = "StartAction";
    public static final String METADATA = "Metadata";
    public static final String ACTIONS = "Actions";
    public static final String ENTRY_POINT_POSITION = "entryPointPosition";
    public static final String SNAP_TO_GRID = "snapToGrid";

    // node-record
    public static final String IDENTIFIER = "Identifier";
    public static final String TYPE = "Type";
    public static final String PARAMETERS = "Parameters";
    public static final String TRANSITIONS = "Transitions";
    public static final String POSITION = "position";
    public static final String X = "x";
    public static final String Y = "y";

    // transitions
    public static final String SUCCESS = "Success";
    public static final String DEFAULT = "Default";
    public static final String ERRORS = "Errors";

    public static final Set<String> DOCUMENT_FIELDS =
            Set.of(VERSION, NAME, DESCRIPTION, START_ACTION, METADATA, ACTIONS);

    public static final Set<String> RECORD_FIELDS =
            Set.of(IDENTIFIER, TYPE, PARAMETERS, METADATA, TRANSITIONS);

    /** Keys a condition match value may not take. */
    public static final Set<String> RESERVED_TRANSITION_KEYS = Set.of(SUCCESS, DEFAULT, ERRORS);

    private WireFields() {
    }
}
