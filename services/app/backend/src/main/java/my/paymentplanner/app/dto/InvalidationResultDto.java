package my.paymentplanner.app.dto;

public record InvalidationResultDto(
		String caseId,
		int invalidatedVersions
) {
}
