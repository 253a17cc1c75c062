package com.sparta.redemption.domain.shortcode.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * 고정(인쇄 캠페인) 숏코드 엔티티
 *
 * code가 PK이므로 같은 코드의 동시 등록은 DB에서 하나만 성공한다.
 * 할당 ID 엔티티라 Persistable로 항상 INSERT(persist)되도록 한다. merge로 덮어쓰지 않음.
 */
@Entity
@Table(name = "static_short_codes", indexes = {
        @Index(name = "idx_static_short_codes_voucher_id", columnList = "voucher_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StaticShortCode implements Persistable<String> {

    @Id
    @Column(name = "code", length = 20)
    private String code;

    @Column(name = "voucher_id", nullable = false)
    private String voucherId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Transient
    private boolean isNew = true;

    private StaticShortCode(String code, String voucherId) {
        this.code = code;
        this.voucherId = voucherId;
    }

    public static StaticShortCode register(String code, String voucherId) {
        return new StaticShortCode(code, voucherId);
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }

    @PostLoad
    @PostPersist
    protected void markNotNew() {
        this.isNew = false;
    }

    @Override
    public String getId() {
        return code;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }
}
