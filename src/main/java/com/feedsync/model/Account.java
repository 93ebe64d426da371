package com.feedsync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("accounts")
public class Account {
    @Id
    private Long id;

    @Column("feed_id")
    private String feedId;

    @Column("name")
    private String name;

    @Column("description")
    private String description;

    @Column("avatar_url")
    private String avatarUrl;

    @Column("feed_url")
    private String feedUrl;

    @Column("is_active")
    private Boolean active;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
