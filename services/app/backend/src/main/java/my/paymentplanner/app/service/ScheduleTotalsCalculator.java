package my.paymentplanner.app.service;

import my.paymentplanner.app.domain.ScheduleItemStatus;
import my.paymentplanner.app.dto.ScheduleTotalsDto;
import my.paymentplanner.app.model.ScheduleLine;
import my.paymentplanner.app.service.util.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

@Component
public class ScheduleTotalsCalculator {

	public ScheduleTotalsDto totals(List<ScheduleLine> lines, BigDecimal wiresReceived) {
		BigDecimal wires = Money.round(wiresReceived);
		Predicate<ScheduleLine> notNsf = line -> line.status() != ScheduleItemStatus.NSF;
		Predicate<ScheduleLine> cleared = line -> line.status() == ScheduleItemStatus.CLEARED;
		Predicate<ScheduleLine> nsf = line -> line.status() == ScheduleItemStatus.NSF;
		Function<ScheduleLine, BigDecimal> banking = line -> line.bankingFeePortion().add(line.secondaryBankingFeePortion());

		return new ScheduleTotalsDto(
				lines.size(),
				sum(lines, notNsf, ScheduleLine::paymentAmount).add(wires),
				sum(lines, notNsf, ScheduleLine::setupFeePortion),
				sum(lines, notNsf, ScheduleLine::programFeePortion),
				sum(lines, notNsf, banking),
				sum(lines, notNsf, ScheduleLine::escrowAmount),
				wires,
				sum(lines, cleared, ScheduleLine::paymentAmount),
				sum(lines, cleared, ScheduleLine::setupFeePortion),
				sum(lines, cleared, ScheduleLine::programFeePortion),
				sum(lines, cleared, banking),
				sum(lines, cleared, ScheduleLine::escrowAmount),
				sum(lines, nsf, ScheduleLine::paymentAmount),
				sum(lines, nsf, ScheduleLine::setupFeePortion),
				sum(lines, nsf, ScheduleLine::programFeePortion),
				sum(lines, nsf, banking),
				sum(lines, nsf, ScheduleLine::escrowAmount)
		);
	}

	/**
	 * Draft numbers by sequence number, counted in date order. NSF and cancelled rows get none and
	 * do not advance the count.
	 */
	public Map<Integer, Integer> draftNumbers(List<ScheduleLine> lines) {
		List<ScheduleLine> ordered = lines.stream()
				.sorted(Comparator.comparing(ScheduleLine::paymentDate).thenComparingInt(ScheduleLine::sequenceNumber))
				.toList();
		Map<Integer, Integer> numbers = new HashMap<>();
		int next = 1;
		for (ScheduleLine line : ordered) {
			if (line.status().countsAsDraft()) {
				numbers.put(line.sequenceNumber(), next++);
			}
		}
		return numbers;
	}

	/**
	 * Sequence numbers whose row differs from the same-numbered row of the previous version. Rows
	 * without a counterpart count as changed; nothing is flagged when there is no previous version.
	 */
	public Set<Integer> changedFromPrevious(List<ScheduleLine> current, List<ScheduleLine> previous) {
		Set<Integer> changed = new HashSet<>();
		if (previous == null || previous.isEmpty()) {
			return changed;
		}
		Map<Integer, ScheduleLine> bySequence = new HashMap<>();
		for (ScheduleLine line : previous) {
			bySequence.put(line.sequenceNumber(), line);
		}
		for (ScheduleLine line : current) {
			ScheduleLine before = bySequence.get(line.sequenceNumber());
			if (before == null || differs(line, before)) {
				changed.add(line.sequenceNumber());
			}
		}
		return changed;
	}

	private boolean differs(ScheduleLine left, ScheduleLine right) {
		return !Objects.equals(left.paymentDate(), right.paymentDate())
				|| left.status() != right.status()
				|| !sameAmount(left.paymentAmount(), right.paymentAmount())
				|| !sameAmount(left.setupFeePortion(), right.setupFeePortion())
				|| !sameAmount(left.programFeePortion(), right.programFeePortion())
				|| !sameAmount(left.bankingFeePortion(), right.bankingFeePortion())
				|| !sameAmount(left.secondaryBankingFeePortion(), right.secondaryBankingFeePortion())
				|| !sameAmount(left.additionalProductsPortion(), right.additionalProductsPortion())
				|| !sameAmount(left.escrowAmount(), right.escrowAmount());
	}

	private boolean sameAmount(BigDecimal left, BigDecimal right) {
		return Money.orZero(left).compareTo(Money.orZero(right)) == 0;
	}

	private BigDecimal sum(List<ScheduleLine> lines, Predicate<ScheduleLine> filter, Function<ScheduleLine, BigDecimal> value) {
		BigDecimal total = Money.ZERO;
		for (ScheduleLine line : lines) {
			if (filter.test(line)) {
				total = total.add(Money.orZero(value.apply(line)));
			}
		}
		return Money.round(total);
	}
}
