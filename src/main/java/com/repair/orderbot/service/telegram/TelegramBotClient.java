package com.repair.orderbot.service.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repair.orderbot.exception.ExtractionException;
import com.repair.orderbot.exception.NotificationException;
import com.repair.orderbot.model.dto.ChoiceOption;
import com.repair.orderbot.service.notify.ChatGateway;
import com.repair.orderbot.service.notify.Notifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Telegram Bot API 客户端：对话回复、主动推送、文档下载
 */
@Slf4j
@Service
public class TelegramBotClient implements ChatGateway, Notifier {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${telegram.bot.enabled:false}")
    private boolean enabled;

    @Value("${telegram.bot.token:}")
    private String token;

    @Value("${telegram.bot.api-base-url:https://api.telegram.org}")
    private String apiBaseUrl;

    public TelegramBotClient(RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void sendPrompt(String channel, String text, List<ChoiceOption> choices) {
        try {
            sendMessage(channel, text, choices);
        } catch (NotificationException e) {
            // 对话回复失败不影响会话状态，操作员可重发
            log.error("对话回复发送失败：channel={}, error={}", channel, e.getMessage());
        }
    }

    @Override
    public void send(String channel, String text) {
        sendMessage(channel, text, null);
    }

    /**
     * 应答按钮回调，消除客户端的加载状态
     */
    public void answerCallback(String callbackQueryId) {
        if (!enabled || callbackQueryId == null) {
            return;
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("callback_query_id", callbackQueryId);
        try {
            restTemplate.postForEntity(methodUrl("answerCallbackQuery"), jsonEntity(payload), String.class);
        } catch (RestClientException e) {
            log.warn("应答回调失败：callbackQueryId={}, error={}", callbackQueryId, e.getMessage());
        }
    }

    /**
     * 下载用户发送的文档
     * @throws ExtractionException 文件信息或内容获取失败
     */
    public byte[] downloadFile(String fileId) {
        if (!enabled) {
            throw new ExtractionException("Telegram 未启用，无法下载文档");
        }
        try {
            Map<String, Object> payload = new HashMap<>();
            payload.put("file_id", fileId);
            ResponseEntity<String> response = restTemplate.postForEntity(methodUrl("getFile"), jsonEntity(payload), String.class);
            if (!StringUtils.hasText(response.getBody())) {
                throw new ExtractionException("获取文件信息失败：Telegram 返回空响应");
            }
            JsonNode root = objectMapper.readTree(response.getBody());
            if (!root.path("ok").asBoolean(false) || !root.path("result").has("file_path")) {
                throw new ExtractionException("获取文件信息失败：" + root.path("description").asText(""));
            }
            String filePath = root.path("result").path("file_path").asText();
            byte[] content = restTemplate.getForObject(apiBaseUrl + "/file/bot" + token + "/" + filePath, byte[].class);
            if (content == null) {
                throw new ExtractionException("文件内容为空");
            }
            log.info("文档下载完成：fileId={}, size={}", fileId, content.length);
            return content;
        } catch (RestClientException e) {
            throw new ExtractionException("下载文档失败：" + e.getMessage(), e);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new ExtractionException("解析文件信息失败：" + e.getMessage(), e);
        }
    }

    private void sendMessage(String chatId, String text, List<ChoiceOption> choices) {
        if (!enabled) {
            log.info("Telegram 未启用，跳过发送：chatId={}, text={}", chatId, abbreviate(text));
            return;
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("chat_id", chatId);
        payload.put("text", text);
        if (choices != null && !choices.isEmpty()) {
            payload.put("reply_markup", inlineKeyboard(choices));
        }

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(methodUrl("sendMessage"), jsonEntity(payload), String.class);
            if (!StringUtils.hasText(response.getBody())) {
                throw new NotificationException("Telegram 返回空响应：chatId=" + chatId);
            }
            JsonNode root = objectMapper.readTree(response.getBody());
            if (!root.path("ok").asBoolean(false)) {
                throw new NotificationException("Telegram 返回失败：" + root.path("description").asText(""));
            }
            log.debug("消息已发送：chatId={}, text={}", chatId, abbreviate(text));
        } catch (RestClientException e) {
            throw new NotificationException("调用 Telegram 接口失败：" + e.getMessage(), e);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new NotificationException("解析 Telegram 响应失败：" + e.getMessage(), e);
        }
    }

    /**
     * 每个按钮单独一行
     */
    private Map<String, Object> inlineKeyboard(List<ChoiceOption> choices) {
        List<List<Map<String, String>>> rows = new ArrayList<>();
        for (ChoiceOption choice : choices) {
            Map<String, String> button = new HashMap<>();
            button.put("text", choice.getLabel());
            button.put("callback_data", choice.getToken());
            List<Map<String, String>> row = new ArrayList<>();
            row.add(button);
            rows.add(row);
        }
        Map<String, Object> markup = new HashMap<>();
        markup.put("inline_keyboard", rows);
        return markup;
    }

    private HttpEntity<Map<String, Object>> jsonEntity(Map<String, Object> payload) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(payload, headers);
    }

    private String methodUrl(String method) {
        return apiBaseUrl + "/bot" + token + "/" + method;
    }

    private String abbreviate(String text) {
        if (text == null) {
            return null;
        }
        return text.length() > 30 ? text.substring(0, 30) + "..." : text;
    }
}
