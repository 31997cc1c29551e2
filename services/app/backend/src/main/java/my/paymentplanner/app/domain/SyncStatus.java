package my.paymentplanner.app.domain;

public enum SyncStatus {
	IN_SYNC,
	OUT_OF_SYNC
}
