package org.mediacatalog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;

@Entity
@Data
@Table(name = "catalog_record")
public class CatalogRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "show_id", unique = true, nullable = false)
    private String showId; // Внешний идентификатор из файла импорта

    @Column(name = "content_type")
    private String type; // Movie или TV Show

    @Column(length = 500)
    private String title;

    @Column(length = 2000)
    private String director;

    @Column(name = "cast_members", length = 4000)
    private String cast; // Актеры через запятую

    @Column(length = 2000)
    private String country; // Страны через запятую

    private String dateAdded;
    private Integer releaseYear; // null, если год неизвестен
    private String rating; // TV-MA, PG, R и т.д.
    private String duration;

    @Column(length = 2000)
    private String listedIn; // Категории/жанры через запятую

    @Column(length = 4000)
    private String description;
}
