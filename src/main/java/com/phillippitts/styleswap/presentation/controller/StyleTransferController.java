package com.phillippitts.styleswap.presentation.controller;

import com.phillippitts.styleswap.exception.ImageDecodeException;
import com.phillippitts.styleswap.exception.ResourceException;
import com.phillippitts.styleswap.service.storage.TransientFileStore;
import com.phillippitts.styleswap.service.storage.TransientImageFile;
import com.phillippitts.styleswap.service.transfer.StyleTransferService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Style transfer over HTTP.
 *
 * <p>{@code POST /api/v1/style-transfer} with multipart parts {@code content} and {@code style};
 * responds with the result as {@code image/png}. Uploads and the result file are deleted before
 * the response is returned.
 */
@RestController
class StyleTransferController {

    private static final Logger LOG = LogManager.getLogger(StyleTransferController.class);

    private final StyleTransferService transferService;
    private final TransientFileStore fileStore;

    StyleTransferController(StyleTransferService transferService, TransientFileStore fileStore) {
        this.transferService = transferService;
        this.fileStore = fileStore;
    }

    @PostMapping(path = "/api/v1/style-transfer",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.IMAGE_PNG_VALUE)
    ResponseEntity<byte[]> transfer(@RequestParam("content") MultipartFile content,
                                    @RequestParam("style") MultipartFile style) {
        LOG.info("Style transfer requested: content={} bytes, style={} bytes", content.getSize(), style.getSize());
        Path contentPath = null;
        Path stylePath = null;
        try {
            contentPath = storeUpload(content);
            stylePath = storeUpload(style);
            try (TransientImageFile result = transferService.transfer(contentPath, stylePath)) {
                byte[] png = Files.readAllBytes(result.path());
                return ResponseEntity.ok().contentType(MediaType.IMAGE_PNG).body(png);
            } catch (IOException e) {
                throw new ResourceException("Failed to read result image", e);
            }
        } finally {
            fileStore.delete(contentPath);
            fileStore.delete(stylePath);
        }
    }

    private Path storeUpload(MultipartFile upload) {
        String name = upload.getOriginalFilename() == null ? upload.getName() : upload.getOriginalFilename();
        if (upload.isEmpty()) {
            throw new ImageDecodeException(name, "upload is empty");
        }
        try (InputStream in = upload.getInputStream()) {
            return fileStore.store(in, suffixOf(name));
        } catch (IOException e) {
            throw new ResourceException("Failed to read upload " + upload.getName(), e);
        }
    }

    static String suffixOf(String filename) {
        int dot = filename == null ? -1 : filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return ".img";
        }
        String ext = filename.substring(dot).toLowerCase();
        return ext.matches("\\.[a-z0-9]{1,5}") ? ext : ".img";
    }
}
