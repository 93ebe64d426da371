package com.feedsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Null fields leave the corresponding flag as it is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArticleFlagsRequest {
    private Boolean read;
    private Boolean favorite;
}
