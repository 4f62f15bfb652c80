package dev.quorum.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ApiKeyRequest(@NotBlank @Size(max = 512) String apiKey) {

    @Override
    public String toString() {
        return "ApiKeyRequest[apiKey=****]";
    }
}
