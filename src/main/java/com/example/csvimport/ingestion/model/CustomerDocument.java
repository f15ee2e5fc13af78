package com.example.csvimport.ingestion.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.Locale;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Getter
@ToString
@NoArgsConstructor
@Document(collection = "customers")
public class CustomerDocument {

    @Id
    private String id;
    private String name;
    private String email;
    @JsonIgnore
    private String emailKey;
    private int age;
    private Instant createdAt;

    public CustomerDocument(String name, String email, int age, Instant createdAt) {
        this.name = name;
        this.email = email;
        this.emailKey = toEmailKey(email);
        this.age = age;
        this.createdAt = createdAt;
    }

    /**
     * Uniqueness key for an email address. Comparison is case-insensitive; the supplied spelling is
     * kept in {@code email}.
     */
    public static String toEmailKey(String email) {
        return email.toLowerCase(Locale.ROOT);
    }
}
