package com.ardua.ledger.billing;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "clients")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Client {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(name = "payment_terms_days", nullable = false)
    private int paymentTermsDays;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static Client create(String name, int paymentTermsDays) {
        if (paymentTermsDays < 0) {
            throw new IllegalArgumentException("Payment terms cannot be negative");
        }
        Client client = new Client();
        client.name = name;
        client.paymentTermsDays = paymentTermsDays;
        client.active = true;
        return client;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }
}
