package com.orderflow.orderservice.model;

import com.orderflow.common.model.Address;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

// Dynamic updates keep entity saves from overwriting inventoryCommitted,
// which only StockLedger's conditional queries may change.
@Entity
@Table(name = "orders")
@DynamicUpdate
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    @Column(nullable = false, unique = true, updatable = false, length = 32)
    @ToString.Include
    private String orderNumber;

    // customer id (JWT subject)
    @Column(nullable = false)
    private UUID userId;

    private String customerName;

    private String customerEmail;

    private String customerPhone;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNo ASC")
    private List<OrderItem> items = new ArrayList<>();

    @Embedded
    private Address shippingAddress;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "fullName", column = @Column(name = "billing_full_name")),
            @AttributeOverride(name = "phone", column = @Column(name = "billing_phone")),
            @AttributeOverride(name = "line1", column = @Column(name = "billing_line1")),
            @AttributeOverride(name = "line2", column = @Column(name = "billing_line2")),
            @AttributeOverride(name = "city", column = @Column(name = "billing_city")),
            @AttributeOverride(name = "state", column = @Column(name = "billing_state")),
            @AttributeOverride(name = "postalCode", column = @Column(name = "billing_postal_code")),
            @AttributeOverride(name = "country", column = @Column(name = "billing_country"))
    })
    private Address billingAddress;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentMethod paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @ToString.Include
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @ToString.Include
    private PaymentStatus paymentStatus;

    @Column(nullable = false)
    private BigDecimal subtotal;

    @Column(nullable = false)
    private BigDecimal tax;

    @Column(nullable = false)
    private BigDecimal shipping;

    @Column(nullable = false)
    private BigDecimal discount = BigDecimal.ZERO;

    @Column(nullable = false)
    private BigDecimal total;

    @Embedded
    private GstSnapshot gst;

    // razorpay order id, or the local cod_ pseudo id
    @Column(unique = true)
    private String gatewayOrderId;

    private String paymentId;

    private Instant paidAt;

    // set and cleared only through StockLedger
    @Column(nullable = false)
    private boolean inventoryCommitted;

    private String trackingNumber;

    private String carrierName;

    @Column(length = 2000)
    private String notes;

    @Column(length = 2000)
    private String customerNotes;

    private Instant shippedAt;

    private Instant deliveredAt;

    private Instant cancelledAt;

    private String refundId;

    private BigDecimal refundAmount;

    @Enumerated(EnumType.STRING)
    private RefundStatus refundStatus;

    private Instant refundedAt;

    @Embedded
    private ShippingPackage shippingPackage;

    @Embedded
    private ShippingPayment shippingPayment;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    // Optimistic locking: an operator status change racing a webhook
    // update fails with OptimisticLockingFailureException instead of
    // silently losing one of them
    @Version
    @Column(name = "version")
    private Long version;
}
