package com.example.templatelocator.controller;

import com.example.templatelocator.model.ImageSize;
import com.example.templatelocator.model.MatchEntry;
import com.example.templatelocator.model.MatchHealthResponse;
import com.example.templatelocator.model.MatchParameters;
import com.example.templatelocator.model.MatchResponse;
import com.example.templatelocator.service.MatchOptions;
import com.example.templatelocator.service.MatchReport;
import com.example.templatelocator.service.MatchSettings;
import com.example.templatelocator.service.TemplateMatchingService;
import com.example.templatelocator.service.matching.MatchCandidate;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.SERVICE_UNAVAILABLE;

@RestController
@RequestMapping("/api/v1/match")
@Tag(name = "Template matching", description = "Locate occurrences of a template image inside a scene")
public class TemplateMatchController {

    private static final Logger log = LoggerFactory.getLogger(TemplateMatchController.class);

    private final TemplateMatchingService service;

    public TemplateMatchController(TemplateMatchingService service) {
        this.service = service;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Find distinct occurrences of a template",
            description = "Extracts high-confidence peaks of the similarity surface and removes overlapping ones by IoU.")
    public ResponseEntity<MatchResponse> match(
            @RequestPart("scene") MultipartFile scene,
            @RequestPart("template") MultipartFile template,
            @Parameter(description = "ccoeff_normed | ccorr_normed | sqdiff_normed") @RequestParam(required = false) String method,
            @Parameter(description = "gray | color") @RequestParam(required = false) String mode,
            @RequestParam(name = "max-results", required = false) Integer maxResults,
            @RequestParam(name = "min-score", required = false) Double minScore,
            @Parameter(description = "IoU threshold in [0,1]") @RequestParam(required = false) Double nms,
            @Parameter(description = "Search region as x,y,w,h") @RequestParam(required = false) String roi,
            @Parameter(description = "bbox | bbox+label | bbox+label+score") @RequestParam(required = false) String draw,
            @RequestParam(required = false) Integer thickness,
            @RequestParam(name = "font-scale", required = false) Double fontScale,
            @RequestParam(defaultValue = "false") boolean heatmap,
            @RequestParam(defaultValue = "false") boolean annotate) {
        MatchOptions options = new MatchOptions(method, mode, maxResults, minScore, nms, roi, draw, thickness,
                fontScale, heatmap, annotate);
        return ResponseEntity.ok(run("match", scene, template, options, false));
    }

    @PostMapping(value = "/best", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Locate the single best position of a template",
            description = "Returns the global extremum of the similarity surface without any score threshold.")
    public ResponseEntity<MatchResponse> matchBest(
            @RequestPart("scene") MultipartFile scene,
            @RequestPart("template") MultipartFile template,
            @RequestParam(required = false) String method,
            @RequestParam(required = false) String mode,
            @RequestParam(required = false) String roi) {
        MatchOptions options = new MatchOptions(method, mode, null, null, null, roi, null, null, null, false, false);
        return ResponseEntity.ok(run("best", scene, template, options, true));
    }

    @GetMapping("/health")
    @Operation(summary = "Retrieve template matching service state and defaults")
    public ResponseEntity<MatchHealthResponse> health() {
        MatchSettings defaults = service.defaultSettings();
        return ResponseEntity.ok(new MatchHealthResponse(service.isEnabled(), toParameters(defaults),
                service.candidatePoolSize(defaults.criteria().maxResults())));
    }

    private MatchResponse run(String command, MultipartFile scene, MultipartFile template,
                              MatchOptions options, boolean bestOnly) {
        if (!service.isEnabled()) {
            throw new ResponseStatusException(SERVICE_UNAVAILABLE, "Template matching service is disabled");
        }
        BufferedImage sceneImage = readImage(scene, "scene");
        BufferedImage templateImage = readImage(template, "template");
        MatchReport report;
        try {
            report = bestOnly
                    ? service.matchBest(sceneImage, templateImage, options)
                    : service.match(sceneImage, templateImage, options);
        } catch (IllegalArgumentException ex) {
            log.debug("Rejected {} request: {}", command, ex.getMessage());
            throw new ResponseStatusException(BAD_REQUEST, ex.getMessage(), ex);
        }
        return toResponse(command, report);
    }

    private MatchResponse toResponse(String command, MatchReport report) {
        List<MatchEntry> entries = new ArrayList<>(report.matches().size());
        for (int i = 0; i < report.matches().size(); i++) {
            MatchCandidate match = report.matches().get(i);
            entries.add(new MatchEntry(i, match.boundingBox(), match.rawScore(), match.confidence()));
        }
        return new MatchResponse(
                command,
                toParameters(report.settings()),
                new ImageSize(report.templateWidth(), report.templateHeight()),
                new ImageSize(report.sceneWidth(), report.sceneHeight()),
                entries,
                new MatchResponse.MatchStats(entries.size(), report.elapsedMs()),
                encode(report.heatmapPng()),
                encode(report.annotatedPng()));
    }

    private MatchParameters toParameters(MatchSettings settings) {
        return new MatchParameters(
                settings.mode().externalName(),
                settings.method().externalName(),
                settings.criteria().maxResults(),
                settings.criteria().minConfidence(),
                settings.criteria().iouThreshold(),
                settings.draw().externalName(),
                settings.thickness(),
                settings.fontScale(),
                settings.roi());
    }

    private String encode(byte[] png) {
        return png != null ? Base64.getEncoder().encodeToString(png) : null;
    }

    private BufferedImage readImage(MultipartFile file, String name) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "The " + name + " image is required");
        }
        try (var inputStream = file.getInputStream()) {
            BufferedImage image = ImageIO.read(inputStream);
            if (image == null) {
                throw new ResponseStatusException(BAD_REQUEST, "Unable to decode " + name + " image");
            }
            return image;
        } catch (IOException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Failed to read " + name + " image", ex);
        }
    }
}
