package locaposty.worker.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Local post authored in the web application and published by the worker.
 *
 * <p>
 * The worker never creates posts. It reads the content fields and moves {@code status} forward through the
 * conditional writes in {@link locaposty.worker.services.PostRecordStore}: a post only leaves {@code SCHEDULED} (or
 * {@code DRAFT}) once, and a {@code DELETED} post is never overwritten.
 *
 * <p>
 * <b>Schema Mapping</b> (table {@code "Post"} of the web application's Prisma schema, quoted camelCase identifiers):
 * <ul>
 * <li>{@code id} (TEXT, PK) - Opaque identifier assigned by the web application</li>
 * <li>{@code locationId} (TEXT, FK) - References "Location".id</li>
 * <li>{@code type} ("PostType" enum) - WHATS_NEW, EVENT, OFFER</li>
 * <li>{@code title} / {@code content} (TEXT) - Event title and post body</li>
 * <li>{@code mediaUrls} (TEXT[]) - Photo and video URLs in display order</li>
 * <li>{@code callToAction} (TEXT) - Internal CTA kind, nullable</li>
 * <li>{@code eventStart}, {@code eventEnd}, {@code offerStart}, {@code offerEnd} (TIMESTAMP)</li>
 * <li>{@code couponCode} (TEXT) - Offer coupon code, nullable</li>
 * <li>{@code scheduledAt} / {@code publishedAt} (TIMESTAMP)</li>
 * <li>{@code status} ("PostStatus" enum) - DRAFT, SCHEDULED, PUBLISHED, FAILED, DELETED</li>
 * </ul>
 * Prisma {@code DateTime} columns carry no zone and hold UTC wall time, hence the explicit TIMESTAMP mapping together
 * with {@code quarkus.hibernate-orm.jdbc.timezone=UTC}. The failure reason of a FAILED post is not a column; it is
 * logged and counted, and the job row keeps the last error.
 */
@Entity
@Table(
        name = "Post")
public class Post extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public String id;

    @ManyToOne(
            fetch = FetchType.EAGER)
    @JoinColumn(
            name = "locationId")
    public Location location;

    @Column(
            name = "type",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public PostType type;

    @Column(
            name = "title")
    public String title;

    @Column(
            name = "content")
    public String content;

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(
            name = "mediaUrls")
    public List<String> mediaUrls = new ArrayList<>();

    @Column(
            name = "callToAction")
    @Enumerated(EnumType.STRING)
    public CallToAction callToAction;

    @JdbcTypeCode(SqlTypes.TIMESTAMP)
    @Column(
            name = "eventStart")
    public Instant eventStart;

    @JdbcTypeCode(SqlTypes.TIMESTAMP)
    @Column(
            name = "eventEnd")
    public Instant eventEnd;

    @JdbcTypeCode(SqlTypes.TIMESTAMP)
    @Column(
            name = "offerStart")
    public Instant offerStart;

    @JdbcTypeCode(SqlTypes.TIMESTAMP)
    @Column(
            name = "offerEnd")
    public Instant offerEnd;

    @Column(
            name = "couponCode")
    public String couponCode;

    @JdbcTypeCode(SqlTypes.TIMESTAMP)
    @Column(
            name = "scheduledAt")
    public Instant scheduledAt;

    @JdbcTypeCode(SqlTypes.TIMESTAMP)
    @Column(
            name = "publishedAt")
    public Instant publishedAt;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public PostStatus status;

    @JdbcTypeCode(SqlTypes.TIMESTAMP)
    @Column(
            name = "createdAt")
    public Instant createdAt;

    @JdbcTypeCode(SqlTypes.TIMESTAMP)
    @Column(
            name = "updatedAt")
    public Instant updatedAt;

    public enum PostType {
        WHATS_NEW, EVENT, OFFER
    }

    /**
     * Post lifecycle statuses. The worker writes PUBLISHED and FAILED; the web application writes the rest.
     */
    public enum PostStatus {
        DRAFT, SCHEDULED, PUBLISHED, FAILED, DELETED;

        /**
         * Statuses the worker is allowed to move a post out of.
         */
        public boolean isOpen() {
            return this == DRAFT || this == SCHEDULED;
        }
    }

    /**
     * Internal call-to-action kinds, mapped to provider action types when the payload is built. {@code NONE} sends no
     * call to action.
     */
    public enum CallToAction {
        NONE, LEARN_MORE, BOOK, ORDER, SHOP, SIGN_UP, CALL_NOW, GET_DIRECTIONS
    }
}
