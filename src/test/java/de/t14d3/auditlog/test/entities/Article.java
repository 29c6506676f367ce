package de.t14d3.auditlog.test.entities;

import de.t14d3.auditlog.annotations.Column;
import de.t14d3.auditlog.annotations.Entity;
import de.t14d3.auditlog.annotations.Id;
import de.t14d3.auditlog.annotations.Table;

@Entity
@Table(name = "articles")
public class Article {
    @Id
    @Column(name = "id")
    private Long id;

    @Column(name = "title")
    private String title;

    @Column(name = "status")
    private String status;

    public Article() {}

    public Article(Long id, String title, String status) {
        this.id = id;
        this.title = title;
        this.status = status;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
}
