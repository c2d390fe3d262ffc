package com.example.filegate;

import com.example.filegate.security.filter.FileAccessGateFilter;
import com.example.filegate.storage.StorageRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class FileGateApplicationTests {

    @Autowired
    private FileAccessGateFilter gateFilter;

    @Autowired
    private StorageRepository storageRepository;

    @Test
    void contextLoads() {
        assertThat(gateFilter).isNotNull();
        assertThat(storageRepository.findByUid(1)).isPresent();
    }
}
