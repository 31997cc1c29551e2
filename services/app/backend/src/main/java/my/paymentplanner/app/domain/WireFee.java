package my.paymentplanner.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Ancillary fee recorded against a schedule item. The item is referenced by id only and may no
 * longer exist.
 */
@Entity
@Table(name = "wire_fees")
public class WireFee {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "wire_fee_id")
	private Long id;

	@Column(name = "schedule_item_id", nullable = false)
	private Long scheduleItemId;

	@Column(name = "fee_type", nullable = false)
	private String feeType;

	@Column(name = "amount")
	private BigDecimal amount;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	public Long getId() {
		return id;
	}

	public void setId(Long id) {
		this.id = id;
	}

	public Long getScheduleItemId() {
		return scheduleItemId;
	}

	public void setScheduleItemId(Long scheduleItemId) {
		this.scheduleItemId = scheduleItemId;
	}

	public String getFeeType() {
		return feeType;
	}

	public void setFeeType(String feeType) {
		this.feeType = feeType;
	}

	public BigDecimal getAmount() {
		return amount;
	}

	public void setAmount(BigDecimal amount) {
		this.amount = amount;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}
}
