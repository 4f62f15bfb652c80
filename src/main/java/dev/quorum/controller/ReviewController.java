package dev.quorum.controller;

import dev.quorum.dto.response.ReviewResponse;
import dev.quorum.service.ReviewQueryService;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/reviews")
public class ReviewController {
    private final ReviewQueryService queryService;

    public ReviewController(ReviewQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/{id}")
    public ResponseEntity<ReviewResponse> getReview(@PathVariable UUID id) {
        return ResponseEntity.ok(queryService.findById(id));
    }

    @GetMapping
    public ResponseEntity<Page<ReviewResponse>> getReviews(@RequestParam(required = false) String repository,
                                                           @RequestParam(defaultValue = "0") int page,
                                                           @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(queryService.findByRepository(repository, page, size));
    }
}
