package com.example.mediastore_backend.controller;

import com.example.mediastore_backend.service.FileService;
import com.example.mediastore_backend.util.PathType;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.UUID;

@RestController
@RequestMapping("/v1/files")
public class FileController {

    private final FileService files;

    public FileController(FileService files) {
        this.files = files;
    }

    @GetMapping(value = "/assets/{id}/{pathType}", produces = MediaType.ALL_VALUE)
    public ResponseEntity<Resource> getAssetFile(
            @PathVariable UUID id,
            @PathVariable String pathType,
            @RequestHeader(value = HttpHeaders.RANGE, required = false) String range,
            @RequestHeader(value = HttpHeaders.IF_NONE_MATCH, required = false) String ifNoneMatch,
            @RequestParam(value = "download", required = false) Integer download
    ) throws IOException {
        PathType type;
        try {
            type = PathType.fromJson(pathType);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "UNKNOWN_PATH_TYPE");
        }
        if (type == null || type.isPersonFile()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "UNKNOWN_PATH_TYPE");
        }
        boolean asDownload = download != null && download == 1;
        return files.stream(id, type, range, ifNoneMatch, asDownload);
    }

    @GetMapping(value = "/people/{id}/thumbnail", produces = MediaType.ALL_VALUE)
    public ResponseEntity<Resource> getPersonThumbnail(
            @PathVariable UUID id,
            @RequestHeader(value = HttpHeaders.IF_NONE_MATCH, required = false) String ifNoneMatch
    ) throws IOException {
        return files.stream(id, PathType.FACE, null, ifNoneMatch, false);
    }
}
