package com.feedsync.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterAccountRequest {

    @NotBlank(message = "feedId is required")
    @Size(max = 255, message = "feedId must be at most 255 characters")
    @Pattern(regexp = "[A-Za-z0-9_.\\-]+", message = "feedId may contain letters, digits, '.', '_' and '-' only")
    private String feedId;

    @Size(max = 255, message = "name must be at most 255 characters")
    private String name;

    /** Runs a full sync right after registration unless explicitly false. */
    private Boolean initialSync;

    public boolean isInitialSyncRequested() {
        return !Boolean.FALSE.equals(initialSync);
    }
}
