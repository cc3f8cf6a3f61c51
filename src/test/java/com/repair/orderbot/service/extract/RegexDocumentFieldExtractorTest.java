package com.repair.orderbot.service.extract;

import com.repair.orderbot.exception.ExtractionException;
import com.repair.orderbot.model.enums.FieldKey;
import com.repair.orderbot.support.PdfFixtures;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegexDocumentFieldExtractorTest {

    private final RegexDocumentFieldExtractor extractor = new RegexDocumentFieldExtractor();

    @Test
    void extractsLabelledFields() {
        String text = "ORDEM DE SERVIÇO\r\n"
                + "Número da O.S. 0045871\r\n"
                + "Chamado: SR-2025-77\r\n"
                + "Prefixo/Dependência: 1234 - Agência Centro Endereço: Rua A, 10\r\n"
                + "Distância: 8,4 Km Ambiente: Urbano\r\n"
                + "Descrição: Gerador não parte\r\n   após queda de energia Sinistro: Não\r\n"
                + "Criticidade: Emergencial Tipo: Corretiva Prazo: 21/10/2025 12:00 Solicitante: Maria\r\n";

        Map<FieldKey, String> fields = extractor.extract(text.getBytes(StandardCharsets.UTF_8), "os.txt", "text/plain");

        assertThat(fields).containsEntry(FieldKey.IDENTIFIER, "0045871")
                .containsEntry(FieldKey.REQUEST_NUMBER, "SR-2025-77")
                .containsEntry(FieldKey.SITE, "1234 - Agência Centro")
                .containsEntry(FieldKey.DISTANCE_KM, "8,4")
                .containsEntry(FieldKey.DESCRIPTION, "Gerador não parte após queda de energia")
                .containsEntry(FieldKey.CRITICALITY, "Emergencial")
                .containsEntry(FieldKey.CATEGORY, "Corretiva")
                .containsEntry(FieldKey.DUE_DATE, "21/10/2025");
    }

    @Test
    void missingLabelsAreLeftOut() {
        Map<FieldKey, String> fields = extractor.extract("Chamado: X1\n".getBytes(StandardCharsets.UTF_8), "a.txt", null);

        assertThat(fields).containsOnlyKeys(FieldKey.REQUEST_NUMBER);
    }

    @Test
    void readsFieldsFromPdfTextLayer() {
        byte[] pdf = PdfFixtures.pdf(
                "Número da O.S. 3003",
                "Chamado: CH-900",
                "Dependência: Agência Centro",
                "Distância: 12,5 km",
                "Descrição: Ar condicionado sem refrigeração",
                "Criticidade: Urgente",
                "Tipo: Corretiva",
                "Prazo: 30/10/2025 18:00");

        Map<FieldKey, String> fields = extractor.extract(pdf, "os.pdf", "application/pdf");

        assertThat(fields).containsEntry(FieldKey.IDENTIFIER, "3003")
                .containsEntry(FieldKey.REQUEST_NUMBER, "CH-900")
                .containsEntry(FieldKey.SITE, "Agência Centro")
                .containsEntry(FieldKey.DISTANCE_KM, "12,5")
                .containsEntry(FieldKey.DESCRIPTION, "Ar condicionado sem refrigeração")
                .containsEntry(FieldKey.CRITICALITY, "Urgente")
                .containsEntry(FieldKey.CATEGORY, "Corretiva")
                .containsEntry(FieldKey.DUE_DATE, "30/10/2025");
    }

    @Test
    void pdfIsDetectedByHeaderWithoutMimeType() {
        Map<FieldKey, String> fields = extractor.extract(PdfFixtures.pdf("Chamado: X1"), "scan", null);

        assertThat(fields).containsOnlyKeys(FieldKey.REQUEST_NUMBER);
    }

    @Test
    void pdfWithoutTextLayerIsRejected() {
        assertThatThrownBy(() -> extractor.extract(PdfFixtures.pdf(), "scan.pdf", "application/pdf"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("没有可识别的文本");
    }

    @Test
    void corruptPdfOrBinaryContentIsRejected() {
        assertThatThrownBy(() -> extractor.extract("not a pdf at all".getBytes(StandardCharsets.US_ASCII), "a.pdf", "application/pdf"))
                .isInstanceOf(ExtractionException.class);
        assertThatThrownBy(() -> extractor.extract(new byte[]{(byte) 0xC3, (byte) 0x28}, "a.bin", null))
                .isInstanceOf(ExtractionException.class);
        assertThatThrownBy(() -> extractor.extract(new byte[0], "empty.txt", "text/plain"))
                .isInstanceOf(ExtractionException.class);
    }
}
