package com.repair.orderbot.service.dialog;

import com.repair.orderbot.model.dto.TurnInput;
import com.repair.orderbot.model.enums.ActionType;
import com.repair.orderbot.model.enums.InputKind;
import com.repair.orderbot.model.enums.WorkflowState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CallbackDataTest {

    @Test
    void decodesActionAndArgument() {
        TurnInput input = CallbackData.decode(CallbackData.encode(ActionType.PICK_FIELD, "DUE_DATE"));

        assertThat(input.getKind()).isEqualTo(InputKind.ACTION);
        assertThat(input.getAction()).isEqualTo(ActionType.PICK_FIELD);
        assertThat(input.getArgument()).isEqualTo("DUE_DATE");
    }

    @Test
    void unknownPayloadDecodesToNoAction() {
        assertThat(CallbackData.decode("tipo_Corretiva").getAction()).isNull();
        assertThat(CallbackData.decode("").getAction()).isNull();
        assertThat(CallbackData.decode(null).getAction()).isNull();
    }

    @Test
    void transitionTableRejectsActionsOutsideTheirState() {
        assertThat(WorkflowTransitions.target(WorkflowState.MENU, ActionType.CREATE))
                .isEqualTo(WorkflowState.COLLECT_IDENTIFIER);
        assertThat(WorkflowTransitions.permits(WorkflowState.MENU, ActionType.CONFIRM)).isFalse();
        assertThat(WorkflowTransitions.permits(WorkflowState.COLLECT_FIELD, null)).isFalse();
        assertThat(WorkflowTransitions.target(WorkflowState.AWAIT_FIELD_VALUE, ActionType.CANCEL))
                .isEqualTo(WorkflowState.MENU);
    }
}
