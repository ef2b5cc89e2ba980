package com.cred.freestyle.groupbuy.api.dto;

import com.cred.freestyle.groupbuy.domain.model.Payment;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for a recorded participation fee.
 *
 * @author Group Buy Team
 */
public class PaymentResponse {

    private String paymentId;
    private String groupId;
    private BigDecimal amount;
    private String message;
    private Instant createdAt;

    public PaymentResponse() {
    }

    public static PaymentResponse fromEntity(Payment payment) {
        PaymentResponse response = new PaymentResponse();
        response.setPaymentId(payment.getPaymentId());
        response.setGroupId(payment.getGroupId());
        response.setAmount(payment.getAmount());
        response.setMessage("Payment successful");
        response.setCreatedAt(payment.getCreatedAt());
        return response;
    }

    public String getPaymentId() {
        return paymentId;
    }

    public void setPaymentId(String paymentId) {
        this.paymentId = paymentId;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
