package com.project.image.compositing;

import com.project.image.compositing.exceptions.StorageException;
import com.project.image.compositing.service.StorageService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StorageServiceTest {

    @TempDir
    Path tmp;

    @Test
    void storeCutout_and_storePhoto_writeIntoSeparateFolders() throws Exception {
        StorageService storage = new StorageService(tmp.toString());

        MockMultipartFile file = new MockMultipartFile("file", "my cutout.png", "image/png", new byte[]{1, 2, 3, 4});
        var cutout = storage.storeCutout(file);
        var photo = storage.storePhoto(new byte[]{8, 9, 10});

        assertThat(Files.readAllBytes(cutout.path())).containsExactly(1, 2, 3, 4);
        assertThat(cutout.filename()).endsWith("my_cutout.png");
        assertThat(cutout.relativeWebPath()).startsWith("uploads/cutouts/");
        assertThat(Files.readAllBytes(photo.path())).containsExactly(8, 9, 10);
        assertThat(photo.relativeWebPath()).startsWith("uploads/photos/");
    }

    @Test
    void storePhoto_neverOverwrites() {
        StorageService storage = new StorageService(tmp.toString());

        var first = storage.storePhoto(new byte[]{1});
        var second = storage.storePhoto(new byte[]{2});

        assertThat(first.path()).isNotEqualTo(second.path());
    }

    @Test
    void storeCutout_rejectsNonImage() {
        StorageService storage = new StorageService(tmp.toString());

        MockMultipartFile notImage = new MockMultipartFile("file", "x.txt", "text/plain", "hi".getBytes());
        assertThatThrownBy(() -> storage.storeCutout(notImage)).isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> storage.storeCutout(new MockMultipartFile("file", new byte[0])))
                .isInstanceOf(StorageException.class);
    }
}
