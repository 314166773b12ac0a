package org.netpreserve.docketcrawl;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import org.netpreserve.docketcrawl.util.AtomicFiles;
import org.netpreserve.docketcrawl.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the files of a case directory:
 * <pre>
 * case.json
 * court_acts.json, cards.json, electronic_case.json
 * instances/&lt;instanceId&gt;.json
 * documents/&lt;docKey&gt;.json (and .pdf)
 * README.md
 * </pre>
 */
public class CaseOutput {
    private static final Logger log = LoggerFactory.getLogger(CaseOutput.class);
    public static final String DOCUMENTS = "documents";
    private final Path directory;

    public CaseOutput(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    public void writeCase(CaseRecord caseRecord) throws IOException {
        writeJson(directory.resolve("case.json"), caseRecord);
    }

    public void writeTab(SourceTab tab, List<DocumentReference> documents) throws IOException {
        writeJson(directory.resolve(tab.key() + ".json"), new TabFile(tab, documents.size(), documents));
    }

    public void writeInstance(InstanceRecord instance, List<DocumentReference> documents) throws IOException {
        writeJson(instanceFile(instance.instanceId()), new InstanceFile(instance, documents.size(), documents));
    }

    /**
     * Instances recorded by earlier runs.
     */
    public Map<String, InstanceRecord> loadInstances() throws IOException {
        var instances = new LinkedHashMap<String, InstanceRecord>();
        Path dir = directory.resolve("instances");
        if (!Files.isDirectory(dir)) return instances;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.json")) {
            for (Path file : stream) {
                try {
                    var instance = Json.MAPPER.readValue(file.toFile(), InstanceRecord.class);
                    if (instance.instanceId() != null) instances.put(instance.instanceId(), instance);
                } catch (IOException e) {
                    log.atWarn().addKeyValue("file", file).log("Ignoring unreadable instance file: {}", e.getMessage());
                }
            }
        }
        return instances;
    }

    public void writeDocument(FetchedDocument document, DocumentIdentity identity, byte[] attachment)
            throws IOException {
        writeJson(documentFile(identity), document);
        if (attachment != null) {
            AtomicFiles.write(directory.resolve(DOCUMENTS).resolve(identity.fileStem() + ".pdf"), attachment);
        }
    }

    public Path documentFile(DocumentIdentity identity) {
        return directory.resolve(DOCUMENTS).resolve(identity.fileStem() + ".json");
    }

    public void writeReadme(CaseRecord caseRecord, Collection<InstanceRecord> instances,
                            Map<String, List<DocumentReference>> documentsByInstance, int totalDocuments,
                            int fetched, int skipped) throws IOException {
        var readme = new StringBuilder();
        readme.append("# Дело ").append(caseRecord.caseNumber()).append("\n\n");
        readme.append("**GUID:** `").append(caseRecord.caseGuid()).append("`  \n");
        readme.append("**Статус:** ").append(caseRecord.status() == null || caseRecord.status().isBlank()
                ? "Не указан" : caseRecord.status()).append("  \n");
        readme.append("**URL:** [").append(caseRecord.caseNumber()).append("](").append(caseRecord.url()).append(")  \n");
        readme.append("**Дата парсинга:** ").append(caseRecord.parsedAt()).append("\n\n");

        readme.append("## Статистика\n\n");
        readme.append("| Метрика | Значение |\n|---------|----------|\n");
        readme.append("| Всего документов | ").append(totalDocuments).append(" |\n");
        readme.append("| Скачано успешно | ").append(fetched).append(" |\n");
        readme.append("| Не удалось скачать | ").append(skipped).append(" |\n");
        readme.append("| Инстанций | ").append(instances.size()).append(" |\n\n");

        readme.append("## Структура\n\n");
        readme.append("- [`case.json`](case.json) — метаданные дела\n");
        readme.append("- [`court_acts.json`](court_acts.json) — судебные акты\n");
        readme.append("- [`cards.json`](cards.json) — карточки\n");
        readme.append("- [`electronic_case.json`](electronic_case.json) — электронное дело\n");
        readme.append("- [`instances/`](instances/) — инстанции (аккордеоны из \"Карточки\")\n");
        readme.append("- [`documents/`](documents/) — полные тексты документов\n\n");

        readme.append("## Инстанции\n\n");
        readme.append("| # | Название | Документов | Страниц |\n|---|----------|------------|---------|\n");
        for (InstanceRecord instance : instances) {
            var documents = documentsByInstance.getOrDefault(instance.instanceId(), List.of());
            int pages = Math.max(1, documents.stream().mapToInt(DocumentReference::page).max().orElse(1));
            readme.append("| ").append(instance.order())
                    .append(" | ").append(instance.instanceType() == null ? instance.instanceId() : instance.instanceType())
                    .append(" | ").append(documents.size())
                    .append(" | ").append(pages).append(" |\n");
        }

        readme.append("\n## Использование\n\n");
        readme.append("Для анализа дела:\n");
        readme.append("1. Начните с `case.json` для общей информации\n");
        readme.append("2. Используйте `court_acts.json` для списка судебных актов\n");
        readme.append("3. Загружайте отдельные документы из `documents/` по `doc_guid`\n\n");
        readme.append("## Примечания\n\n");
        readme.append("- Документы с `requires_manual_review: true` — сканы, текст не извлечён\n");
        readme.append("- Поле `text` в документах содержит извлечённый текст\n");
        readme.append("- Связи между табами через `identity` и `source_tabs`\n");

        AtomicFiles.write(directory.resolve("README.md"), readme.toString().getBytes(StandardCharsets.UTF_8));
    }

    private Path instanceFile(String instanceId) {
        return directory.resolve("instances").resolve(instanceId.replaceAll("[^0-9A-Za-z._-]", "_") + ".json");
    }

    private void writeJson(Path file, Object value) throws IOException {
        AtomicFiles.write(file, Json.MAPPER.writeValueAsBytes(value));
    }

    record TabFile(SourceTab tab, int count, List<DocumentReference> documents) {
    }

    record InstanceFile(@JsonUnwrapped InstanceRecord instance, int documentCount, List<DocumentReference> documents) {
    }
}
