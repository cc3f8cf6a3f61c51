package com.repair.orderbot.service.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repair.orderbot.model.dto.ChatUpdate;
import com.repair.orderbot.model.dto.TurnInput;
import com.repair.orderbot.service.dialog.CallbackData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Telegram Bot API Update 解析
 */
@Slf4j
@Component
public class TelegramUpdateParser {

    private final ObjectMapper objectMapper;

    public TelegramUpdateParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return 解析结果；不需要处理的更新（编辑消息、贴纸等）返回 null
     */
    public ChatUpdate parse(String rawUpdate) {
        if (rawUpdate == null || rawUpdate.trim().isEmpty()) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(rawUpdate);

            if (root.has("callback_query")) {
                JsonNode query = root.get("callback_query");
                JsonNode message = query.get("message");
                String chatId = message != null ? getText(message.get("chat"), "id") : null;
                String userId = getText(query.get("from"), "id");
                if (chatId == null) {
                    return null;
                }
                return ChatUpdate.builder()
                        .sessionId(sessionId(chatId, userId))
                        .channel(chatId)
                        .input(CallbackData.decode(getText(query, "data")))
                        .callbackQueryId(getText(query, "id"))
                        .build();
            }

            JsonNode message = root.get("message");
            if (message == null) {
                return null;
            }
            String chatId = getText(message.get("chat"), "id");
            String userId = getText(message.get("from"), "id");
            if (chatId == null) {
                return null;
            }
            ChatUpdate.ChatUpdateBuilder builder = ChatUpdate.builder()
                    .sessionId(sessionId(chatId, userId))
                    .channel(chatId);

            if (message.has("document")) {
                JsonNode document = message.get("document");
                return builder
                        .fileId(getText(document, "file_id"))
                        .input(TurnInput.document(null, getText(document, "file_name"), getText(document, "mime_type")))
                        .build();
            }

            String text = getText(message, "text");
            if (text == null) {
                return null;
            }
            return builder.input(toInput(text)).build();
        } catch (Exception e) {
            log.warn("解析 Telegram Update 失败: {}", e.getMessage());
            return null;
        }
    }

    /**
     * 以 / 开头的文本视为命令，去掉 @机器人名 和参数
     */
    public static TurnInput toInput(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("/") && trimmed.length() > 1) {
            String command = trimmed.substring(1).split("\\s+", 2)[0];
            int at = command.indexOf('@');
            if (at >= 0) {
                command = command.substring(0, at);
            }
            return TurnInput.command(command.toLowerCase());
        }
        return TurnInput.text(text);
    }

    private String sessionId(String chatId, String userId) {
        return userId != null ? chatId + ":" + userId : chatId;
    }

    private String getText(JsonNode node, String field) {
        if (node == null || !node.has(field) || node.get(field).isNull()) {
            return null;
        }
        String value = node.get(field).asText();
        return value != null && !value.trim().isEmpty() ? value : null;
    }
}
