package com.repair.orderbot.service.extract;

import com.repair.orderbot.exception.ExtractionException;
import com.repair.orderbot.model.enums.FieldKey;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 按标签提取工单文档中的字段，支持 PDF（PDFBox 提取文本层）和 UTF-8 纯文本导出
 * 标签沿用上游派单系统导出的葡语字段名
 */
@Slf4j
@Component
public class RegexDocumentFieldExtractor implements DocumentFieldExtractor {

    private static final Map<FieldKey, Pattern> PATTERNS = new LinkedHashMap<>();

    private static final Pattern DATE_TOKEN = Pattern.compile("\\d{2}/\\d{2}/\\d{4}");

    static {
        PATTERNS.put(FieldKey.IDENTIFIER, Pattern.compile("Número da O\\.S\\.\\s*(\\d+)"));
        PATTERNS.put(FieldKey.REQUEST_NUMBER, Pattern.compile("Chamado:\\s*([A-Z0-9\\-]+)"));
        PATTERNS.put(FieldKey.SITE, Pattern.compile("Dependência:\\s*(.+?)(?=\\s*(?:Endereço:|\\n|$))"));
        PATTERNS.put(FieldKey.DISTANCE_KM, Pattern.compile("Distância:\\s*([\\d\\s,.]+?)(?=\\s*(?:km|Km|KM|Ambiente:|\\n|$))"));
        PATTERNS.put(FieldKey.DESCRIPTION, Pattern.compile("Descrição:\\s*(.+?)(?=\\s*(?:Sinistro:|Criticidade:|Tipo:|$))", Pattern.DOTALL));
        PATTERNS.put(FieldKey.CRITICALITY, Pattern.compile("Criticidade:\\s*(.+?)(?=\\s*(?:Tipo:|Prazo:|Solicitante:|\\n|$))"));
        PATTERNS.put(FieldKey.CATEGORY, Pattern.compile("Tipo:\\s*(.+?)(?=\\s*(?:Prazo:|Solicitante:|Matrícula:|\\n|$))"));
        PATTERNS.put(FieldKey.DUE_DATE, Pattern.compile("Prazo:\\s*(.+?)(?=\\s*(?:Solicitante:|Matrícula:|Telefone:|\\n|$))"));
    }

    @Override
    public Map<FieldKey, String> extract(byte[] content, String fileName, String mimeType) {
        String text = decode(content, fileName, mimeType);
        Map<FieldKey, String> fields = new EnumMap<>(FieldKey.class);

        for (Map.Entry<FieldKey, Pattern> entry : PATTERNS.entrySet()) {
            Matcher m = entry.getValue().matcher(text);
            if (!m.find()) {
                continue;
            }
            String value = clean(entry.getKey(), m.group(1));
            if (!value.isEmpty()) {
                fields.put(entry.getKey(), value);
            }
        }

        log.info("文档字段提取完成：fileName={}, fields={}", fileName, fields.keySet());
        return fields;
    }

    private String decode(byte[] content, String fileName, String mimeType) {
        if (content == null || content.length == 0) {
            throw new ExtractionException("文档内容为空");
        }
        if ((mimeType != null && mimeType.contains("pdf")) || startsWith(content, "%PDF")) {
            return readPdf(content, fileName);
        }
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
            if (text.indexOf('\0') >= 0) {
                throw new ExtractionException("文档不是文本格式：" + fileName);
            }
            return text.replace("\r\n", "\n");
        } catch (CharacterCodingException e) {
            throw new ExtractionException("文档不是 UTF-8 文本：" + fileName, e);
        }
    }

    private String readPdf(byte[] content, String fileName) {
        try (PDDocument document = Loader.loadPDF(content)) {
            String text = new PDFTextStripper().getText(document);
            if (text == null || text.trim().isEmpty()) {
                // 扫描件没有文本层
                throw new ExtractionException("PDF 中没有可识别的文本：" + fileName);
            }
            log.debug("PDF 文本提取完成：fileName={}, pages={}, chars={}",
                    fileName, document.getNumberOfPages(), text.length());
            return text.replace("\r\n", "\n");
        } catch (IOException e) {
            throw new ExtractionException("无法读取 PDF 文档：" + fileName, e);
        }
    }

    private String clean(FieldKey key, String raw) {
        String value = raw.trim();
        switch (key) {
            case DESCRIPTION:
                // 描述合并为单行
                return value.replaceAll("\\s+", " ");
            case DUE_DATE:
                // 上游常带时间部分，只取日期
                Matcher m = DATE_TOKEN.matcher(value);
                return m.find() ? m.group() : value;
            default:
                return value.replaceAll("[ \\t]+", " ");
        }
    }

    private boolean startsWith(byte[] content, String prefix) {
        byte[] p = prefix.getBytes(StandardCharsets.US_ASCII);
        if (content.length < p.length) {
            return false;
        }
        for (int i = 0; i < p.length; i++) {
            if (content[i] != p[i]) {
                return false;
            }
        }
        return true;
    }
}
