package ai.eigloo.contactflow.graph.builder;

/**
 * Type tags of the blocks the builder has convenience constructors for.
 * Any other tag can still be used through {@link FlowBuilder#add}.
 */
public final class BlockTypes {

    public static final String MESSAGE_PARTICIPANT = "MessageParticipant";
    public static final String GET_PARTICIPANT_INPUT = "GetParticipantInput";
    public static final String DISCONNECT_PARTICIPANT = "DisconnectParticipant";
    public static final String TRANSFER_TO_FLOW = "TransferToFlow";
    public static final String CONNECT_PARTICIPANT_WITH_LEX_BOT = "ConnectParticipantWithLexBot";
    public static final String INVOKE_LAMBDA_FUNCTION = "InvokeLambdaFunction";
    public static final String CHECK_HOURS_OF_OPERATION = "CheckHoursOfOperation";
    public static final String UPDATE_CONTACT_ATTRIBUTES = "UpdateContactAttributes";
    public static final String UPDATE_CONTACT_TARGET_QUEUE = "UpdateContactTargetQueue";
    public static final String SHOW_VIEW = "ShowView";
    public static final String END_FLOW_EXECUTION = "EndFlowExecution";

    private BlockTypes() {
    }
}
