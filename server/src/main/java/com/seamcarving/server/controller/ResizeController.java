package com.seamcarving.server.controller;

import com.seamcarving.server.service.ResizeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;

@RestController
public class ResizeController {

    private static final Logger logger = LoggerFactory.getLogger(ResizeController.class);
    private final ResizeService resizeService;

    public ResizeController(ResizeService resizeService) {
        this.resizeService = resizeService;
    }

    @PostMapping("/resize")
    public ResponseEntity<?> resize(@RequestParam("width") int width, @RequestParam("height") int height,
            @RequestBody byte[] image) {
        logger.info("Received resize request to {}x{} ({} bytes)", width, height, image == null ? 0 : image.length);

        try {
            ResizeService.ResizeResult result = resizeService.resize(image, width, height);
            return ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType("image/" + result.format))
                    .header("X-Seams-Removed-X", String.valueOf(result.seamsRemovedX))
                    .header("X-Seams-Removed-Y", String.valueOf(result.seamsRemovedY))
                    .body(result.image);
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected resize request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (IOException e) {
            logger.error("Failed to process resize request", e);
            return ResponseEntity.status(500).body("Failed to process image: " + e.getMessage());
        }
    }
}
