package com.repair.orderbot.model.dto;

import com.repair.orderbot.model.enums.ActionType;
import com.repair.orderbot.model.enums.InputKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一轮对话输入
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnInput {

    private InputKind kind;

    /**
     * COMMAND：不含斜杠的命令名，如 start、cancel
     */
    private String command;

    /**
     * ACTION：按钮动作；回调数据无法识别时为 null
     */
    private ActionType action;

    /**
     * ACTION 的参数，如字段名或枚举名
     */
    private String argument;

    /**
     * TEXT：原始文本
     */
    private String text;

    // --- DOCUMENT ---
    private byte[] documentContent;
    private String documentName;
    private String documentMimeType;

    public static TurnInput text(String text) {
        return TurnInput.builder().kind(InputKind.TEXT).text(text).build();
    }

    public static TurnInput command(String command) {
        return TurnInput.builder().kind(InputKind.COMMAND).command(command).build();
    }

    public static TurnInput action(ActionType action) {
        return action(action, null);
    }

    public static TurnInput action(ActionType action, String argument) {
        return TurnInput.builder().kind(InputKind.ACTION).action(action).argument(argument).build();
    }

    public static TurnInput document(byte[] content, String name, String mimeType) {
        return TurnInput.builder()
                .kind(InputKind.DOCUMENT)
                .documentContent(content)
                .documentName(name)
                .documentMimeType(mimeType)
                .build();
    }

    public boolean isAction(ActionType type) {
        return kind == InputKind.ACTION && action == type;
    }
}
