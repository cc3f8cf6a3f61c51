package com.repair.orderbot.controller;

import com.repair.orderbot.exception.ExtractionException;
import com.repair.orderbot.model.dto.ChatTurnDTO;
import com.repair.orderbot.model.dto.ChatUpdate;
import com.repair.orderbot.model.dto.ManualReminder;
import com.repair.orderbot.model.dto.TurnInput;
import com.repair.orderbot.model.enums.InputKind;
import com.repair.orderbot.model.enums.WorkflowState;
import com.repair.orderbot.service.dialog.CallbackData;
import com.repair.orderbot.service.dialog.WorkOrderDialogService;
import com.repair.orderbot.service.reminder.ReminderScheduler;
import com.repair.orderbot.service.telegram.TelegramBotClient;
import com.repair.orderbot.service.telegram.TelegramUpdateParser;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/chat")
@Slf4j
public class ChatWebhookController {

    private final WorkOrderDialogService dialogService;
    private final TelegramUpdateParser updateParser;
    private final TelegramBotClient telegramBotClient;
    private final ReminderScheduler reminderScheduler;

    public ChatWebhookController(WorkOrderDialogService dialogService,
                                 TelegramUpdateParser updateParser,
                                 TelegramBotClient telegramBotClient,
                                 ReminderScheduler reminderScheduler) {
        this.dialogService = dialogService;
        this.updateParser = updateParser;
        this.telegramBotClient = telegramBotClient;
        this.reminderScheduler = reminderScheduler;
    }

    /**
     * Telegram webhook，始终返回 200，避免 Telegram 反复重投
     */
    @PostMapping("/telegram")
    public ResponseEntity<Map<String, Object>> onTelegramUpdate(@RequestBody String rawUpdate) {
        String traceId = UUID.randomUUID().toString().replace("-", "");
        MDC.put("traceId", traceId);
        try {
            ChatUpdate update = updateParser.parse(rawUpdate);
            if (update == null) {
                log.debug("[traceId={}] 忽略不需要处理的 Update", traceId);
                return ResponseEntity.ok(result("IGNORED", null));
            }
            log.info("[traceId={}] 收到 Telegram 消息：sessionId={}, kind={}",
                    traceId, update.getSessionId(), update.getInput().getKind());

            telegramBotClient.answerCallback(update.getCallbackQueryId());

            TurnInput input = update.getInput();
            if (input.getKind() == InputKind.DOCUMENT) {
                try {
                    input.setDocumentContent(telegramBotClient.downloadFile(update.getFileId()));
                } catch (ExtractionException e) {
                    log.warn("[traceId={}] 文档下载失败：fileId={}, error={}", traceId, update.getFileId(), e.getMessage());
                    telegramBotClient.sendPrompt(update.getChannel(), "⚠️ 文档下载失败，请重新发送。", null);
                    return ResponseEntity.ok(result("FAILED", null));
                }
            }

            WorkflowState state = dialogService.handle(update.getSessionId(), update.getChannel(), input);
            return ResponseEntity.ok(result("OK", state));
        } finally {
            MDC.remove("traceId");
        }
    }

    /**
     * 通用对话入口，供其他通道或联调使用
     */
    @PostMapping("/turn")
    public ResponseEntity<Map<String, Object>> onTurn(@RequestBody ChatTurnDTO turn) {
        String traceId = UUID.randomUUID().toString().replace("-", "");
        MDC.put("traceId", traceId);
        try {
            if (turn == null || !StringUtils.hasText(turn.getSessionId())) {
                throw new IllegalArgumentException("sessionId不能为空");
            }
            String channel = StringUtils.hasText(turn.getChannel()) ? turn.getChannel() : turn.getSessionId();

            TurnInput input;
            if (StringUtils.hasText(turn.getCallbackData())) {
                input = CallbackData.decode(turn.getCallbackData());
            } else if (turn.getText() != null) {
                input = TelegramUpdateParser.toInput(turn.getText());
            } else {
                throw new IllegalArgumentException("text 和 callbackData 不能同时为空");
            }

            log.info("[traceId={}] 收到对话输入：sessionId={}, kind={}", traceId, turn.getSessionId(), input.getKind());
            WorkflowState state = dialogService.handle(turn.getSessionId(), channel, input);
            return ResponseEntity.ok(result("OK", state));
        } finally {
            MDC.remove("traceId");
        }
    }

    /**
     * 待触发的提醒，channel 为空时返回全部
     */
    @GetMapping("/reminders")
    public ResponseEntity<List<ManualReminder>> pendingReminders(@RequestParam(name = "channel", required = false) String channel) {
        return ResponseEntity.ok(reminderScheduler.listPending(channel));
    }

    private Map<String, Object> result(String status, WorkflowState state) {
        Map<String, Object> body = new HashMap<>();
        body.put("status", status);
        if (state != null) {
            body.put("state", state.name());
        }
        return body;
    }
}
