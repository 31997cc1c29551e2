package my.paymentplanner.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import my.paymentplanner.app.model.ScheduleLine;

import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Table(name = "schedule_items")
public class ScheduleItem {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "schedule_item_id")
	private Long id;

	@ManyToOne(fetch = FetchType.LAZY, optional = false)
	@JoinColumn(name = "plan_version_id", nullable = false)
	private PlanVersion planVersion;

	@Column(name = "sequence_number", nullable = false)
	private Integer sequenceNumber;

	@Column(name = "payment_date", nullable = false)
	private LocalDate paymentDate;

	@Column(name = "payment_amount", nullable = false)
	private BigDecimal paymentAmount;

	@Column(name = "setup_fee_portion", nullable = false)
	private BigDecimal setupFeePortion;

	@Column(name = "program_fee_portion", nullable = false)
	private BigDecimal programFeePortion;

	@Column(name = "banking_fee_portion", nullable = false)
	private BigDecimal bankingFeePortion;

	@Column(name = "secondary_banking_fee_portion", nullable = false)
	private BigDecimal secondaryBankingFeePortion;

	@Column(name = "additional_products_portion", nullable = false)
	private BigDecimal additionalProductsPortion;

	@Column(name = "escrow_amount", nullable = false)
	private BigDecimal escrowAmount;

	@Column(name = "running_balance", nullable = false)
	private BigDecimal runningBalance;

	@Enumerated(EnumType.STRING)
	@Column(name = "status", nullable = false)
	private ScheduleItemStatus status;

	// First item of the carry-forward chain; wire fees stay attached to it across versions.
	@Column(name = "origin_item_id")
	private Long originItemId;

	public static ScheduleItem fromLine(ScheduleLine line) {
		ScheduleItem item = new ScheduleItem();
		item.applyLine(line);
		return item;
	}

	/**
	 * Copy of a frozen row for a new version. Every value is kept as is.
	 */
	public ScheduleItem carryForward() {
		ScheduleItem copy = fromLine(toLine());
		copy.setOriginItemId(lineageId());
		return copy;
	}

	public void applyLine(ScheduleLine line) {
		this.sequenceNumber = line.sequenceNumber();
		this.paymentDate = line.paymentDate();
		this.paymentAmount = line.paymentAmount();
		this.setupFeePortion = line.setupFeePortion();
		this.programFeePortion = line.programFeePortion();
		this.bankingFeePortion = line.bankingFeePortion();
		this.secondaryBankingFeePortion = line.secondaryBankingFeePortion();
		this.additionalProductsPortion = line.additionalProductsPortion();
		this.escrowAmount = line.escrowAmount();
		this.runningBalance = line.runningBalance();
		this.status = line.status();
	}

	public ScheduleLine toLine() {
		return new ScheduleLine(sequenceNumber, paymentDate, paymentAmount, setupFeePortion, programFeePortion,
				bankingFeePortion, secondaryBankingFeePortion, additionalProductsPortion, escrowAmount,
				runningBalance, status);
	}

	public Long lineageId() {
		return originItemId != null ? originItemId : id;
	}

	public boolean isFrozen() {
		return status != null && status.isFrozen();
	}

	public Long getId() {
		return id;
	}

	public void setId(Long id) {
		this.id = id;
	}

	public PlanVersion getPlanVersion() {
		return planVersion;
	}

	public void setPlanVersion(PlanVersion planVersion) {
		this.planVersion = planVersion;
	}

	public Integer getSequenceNumber() {
		return sequenceNumber;
	}

	public void setSequenceNumber(Integer sequenceNumber) {
		this.sequenceNumber = sequenceNumber;
	}

	public LocalDate getPaymentDate() {
		return paymentDate;
	}

	public void setPaymentDate(LocalDate paymentDate) {
		this.paymentDate = paymentDate;
	}

	public BigDecimal getPaymentAmount() {
		return paymentAmount;
	}

	public void setPaymentAmount(BigDecimal paymentAmount) {
		this.paymentAmount = paymentAmount;
	}

	public BigDecimal getSetupFeePortion() {
		return setupFeePortion;
	}

	public void setSetupFeePortion(BigDecimal setupFeePortion) {
		this.setupFeePortion = setupFeePortion;
	}

	public BigDecimal getProgramFeePortion() {
		return programFeePortion;
	}

	public void setProgramFeePortion(BigDecimal programFeePortion) {
		this.programFeePortion = programFeePortion;
	}

	public BigDecimal getBankingFeePortion() {
		return bankingFeePortion;
	}

	public void setBankingFeePortion(BigDecimal bankingFeePortion) {
		this.bankingFeePortion = bankingFeePortion;
	}

	public BigDecimal getSecondaryBankingFeePortion() {
		return secondaryBankingFeePortion;
	}

	public void setSecondaryBankingFeePortion(BigDecimal secondaryBankingFeePortion) {
		this.secondaryBankingFeePortion = secondaryBankingFeePortion;
	}

	public BigDecimal getAdditionalProductsPortion() {
		return additionalProductsPortion;
	}

	public void setAdditionalProductsPortion(BigDecimal additionalProductsPortion) {
		this.additionalProductsPortion = additionalProductsPortion;
	}

	public BigDecimal getEscrowAmount() {
		return escrowAmount;
	}

	public void setEscrowAmount(BigDecimal escrowAmount) {
		this.escrowAmount = escrowAmount;
	}

	public BigDecimal getRunningBalance() {
		return runningBalance;
	}

	public void setRunningBalance(BigDecimal runningBalance) {
		this.runningBalance = runningBalance;
	}

	public ScheduleItemStatus getStatus() {
		return status;
	}

	public void setStatus(ScheduleItemStatus status) {
		this.status = status;
	}

	public Long getOriginItemId() {
		return originItemId;
	}

	public void setOriginItemId(Long originItemId) {
		this.originItemId = originItemId;
	}
}
