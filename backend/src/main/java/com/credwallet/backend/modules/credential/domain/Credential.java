package com.credwallet.backend.modules.credential.domain;

import com.credwallet.backend.global.jpa.AbstractTimestampedEntity;
import com.credwallet.backend.modules.identity.domain.VaultUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Encrypted secret owned by exactly one user. Ciphertext and IV are carried as-is;
 * accessors hand out copies so callers never share the stored arrays.
 */
@Entity
@Table(name = "credentials")
public class Credential extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private VaultUser owner;

    @Column(name = "user_id", insertable = false, updatable = false)
    private Long ownerId;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "description")
    private String description;

    @Column(name = "data_encrypted", nullable = false)
    private byte[] ciphertext;

    @Column(name = "iv")
    private byte[] iv;

    protected Credential() {
    }

    public Credential(VaultUser owner, String title, String description, byte[] ciphertext, byte[] iv) {
        this.owner = owner;
        this.ownerId = owner.getId();
        this.title = title;
        this.description = description;
        this.ciphertext = ciphertext.clone();
        this.iv = iv != null ? iv.clone() : null;
    }

    public Long getId() {
        return id;
    }

    public Long getOwnerId() {
        return ownerId;
    }

    public boolean isOwnedBy(Long userId) {
        return ownerId != null && ownerId.equals(userId);
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public void rename(String title, String description) {
        this.title = title;
        this.description = description;
    }

    public byte[] getCiphertext() {
        return ciphertext.clone();
    }

    public byte[] getIv() {
        return iv != null ? iv.clone() : null;
    }

    public void replaceSecret(byte[] ciphertext, byte[] iv) {
        this.ciphertext = ciphertext.clone();
        this.iv = iv != null ? iv.clone() : null;
    }
}
