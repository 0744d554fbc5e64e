package com.example.projectservice.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * External URL owned by a project. The set is replaced wholesale (delete then insert).
 */
@Entity
@Table(name = "link")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Link {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "project_id", nullable = false)
    private Long projectId;

    @Column(name = "link", nullable = false)
    private String link;
}
