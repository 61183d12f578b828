package com.openrangelabs.donpetre.pipeline;

import com.openrangelabs.donpetre.pipeline.config.BatchSettings;
import com.openrangelabs.donpetre.pipeline.service.IngestionPipeline;
import com.openrangelabs.donpetre.pipeline.storage.InMemoryStorageAdapter;
import com.openrangelabs.donpetre.pipeline.storage.StorageAdapter;
import com.openrangelabs.donpetre.pipeline.upload.UploadGate;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@TestPropertySource(properties = {
        "ingestion.batch.size=50",
        "ingestion.csv.delimiter=;"
})
class DataIngestionApplicationTest {

    @Autowired
    private IngestionPipeline pipeline;

    @Autowired
    private StorageAdapter storageAdapter;

    @Autowired
    private BatchSettings batchSettings;

    @Autowired
    private UploadGate uploadGate;

    @Test
    void contextLoads_WithEveryFileFormatRegistered() {
        assertThat(pipeline.getSourceTypes())
                .contains("csv", "tsv", "text", "jsonl", "json", "zip", "xml", "pdf", "excel", "parquet", "avro");
        assertThat(storageAdapter).isInstanceOf(InMemoryStorageAdapter.class);
        assertThat(batchSettings.getBatchSize()).isEqualTo(50);
        assertThat(uploadGate).isNotNull();
    }
}
