package my.paymentplanner.app.domain;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import my.paymentplanner.app.config.PlanConfigurationConverter;
import my.paymentplanner.app.model.PlanConfiguration;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "plan_versions")
public class PlanVersion {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "plan_version_id")
	private Long id;

	@Column(name = "case_id", nullable = false)
	private String caseId;

	@Column(name = "version_number", nullable = false)
	private Integer versionNumber;

	@Enumerated(EnumType.STRING)
	@Column(name = "status", nullable = false)
	private PlanVersionStatus status;

	@Column(name = "is_primary", nullable = false)
	private boolean primary;

	@Enumerated(EnumType.STRING)
	@Column(name = "sync_status", nullable = false)
	private SyncStatus syncStatus;

	@Column(name = "supersedes_id")
	private Long supersedesId;

	@Column(name = "total_debt", nullable = false)
	private BigDecimal totalDebt;

	@Column(name = "current_payment")
	private BigDecimal currentPayment;

	@Convert(converter = PlanConfigurationConverter.class)
	@Column(name = "configuration_json", nullable = false, columnDefinition = "TEXT")
	private PlanConfiguration configuration;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "created_by", nullable = false)
	private String createdBy;

	@Version
	@Column(name = "lock_version", nullable = false)
	private long lockVersion;

	@OneToMany(mappedBy = "planVersion", cascade = CascadeType.ALL, orphanRemoval = true)
	@OrderBy("sequenceNumber ASC")
	private List<ScheduleItem> items = new ArrayList<>();

	public void addItem(ScheduleItem item) {
		item.setPlanVersion(this);
		items.add(item);
	}

	public Long getId() {
		return id;
	}

	public void setId(Long id) {
		this.id = id;
	}

	public String getCaseId() {
		return caseId;
	}

	public void setCaseId(String caseId) {
		this.caseId = caseId;
	}

	public Integer getVersionNumber() {
		return versionNumber;
	}

	public void setVersionNumber(Integer versionNumber) {
		this.versionNumber = versionNumber;
	}

	public PlanVersionStatus getStatus() {
		return status;
	}

	public void setStatus(PlanVersionStatus status) {
		this.status = status;
	}

	public boolean isPrimary() {
		return primary;
	}

	public void setPrimary(boolean primary) {
		this.primary = primary;
	}

	public SyncStatus getSyncStatus() {
		return syncStatus;
	}

	public void setSyncStatus(SyncStatus syncStatus) {
		this.syncStatus = syncStatus;
	}

	public Long getSupersedesId() {
		return supersedesId;
	}

	public void setSupersedesId(Long supersedesId) {
		this.supersedesId = supersedesId;
	}

	public BigDecimal getTotalDebt() {
		return totalDebt;
	}

	public void setTotalDebt(BigDecimal totalDebt) {
		this.totalDebt = totalDebt;
	}

	public BigDecimal getCurrentPayment() {
		return currentPayment;
	}

	public void setCurrentPayment(BigDecimal currentPayment) {
		this.currentPayment = currentPayment;
	}

	public PlanConfiguration getConfiguration() {
		return configuration;
	}

	public void setConfiguration(PlanConfiguration configuration) {
		this.configuration = configuration;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}

	public String getCreatedBy() {
		return createdBy;
	}

	public void setCreatedBy(String createdBy) {
		this.createdBy = createdBy;
	}

	public long getLockVersion() {
		return lockVersion;
	}

	public List<ScheduleItem> getItems() {
		return items;
	}
}
