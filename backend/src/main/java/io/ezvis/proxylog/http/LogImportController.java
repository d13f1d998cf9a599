package io.ezvis.proxylog.http;

import io.ezvis.proxylog.service.LogImportService;
import io.ezvis.proxylog.service.dto.ImportSummary;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/imports")
@RequiredArgsConstructor
public class LogImportController {

    private final LogImportService importService;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ImportSummary upload(@RequestPart("file") MultipartFile file) throws IOException {
        String fileName = StringUtils.hasText(file.getOriginalFilename())
                ? file.getOriginalFilename()
                : "upload.log";
        try (InputStream input = file.getInputStream()) {
            return importService.importStream(fileName, input);
        }
    }

    /** Imports a file already present on the server. */
    @PostMapping
    public ImportSummary importPath(@RequestParam("path") String path) {
        return importService.importFile(Path.of(path));
    }
}
