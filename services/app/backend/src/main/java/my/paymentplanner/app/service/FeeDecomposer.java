package my.paymentplanner.app.service;

import my.paymentplanner.app.domain.ScheduleItemStatus;
import my.paymentplanner.app.model.PlanConfiguration;
import my.paymentplanner.app.model.ScheduleLine;
import my.paymentplanner.app.service.util.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits scheduled payments into their fee portions. The contribution toward the program cost is
 * divided by the split ratios; escrow takes the rounding remainder so the portions always add up
 * to the payment amount exactly.
 */
@Component
public class FeeDecomposer {

	public ScheduleLine decompose(int sequenceNumber,
								  LocalDate paymentDate,
								  BigDecimal contribution,
								  BigDecimal setupFeePortion,
								  BigDecimal balanceBefore,
								  PlanConfiguration configuration) {
		BigDecimal net = Money.round(contribution);
		BigDecimal setup = Money.round(setupFeePortion);
		BigDecimal banking = Money.round(configuration.bankingFee());
		BigDecimal secondary = Money.round(configuration.secondaryBankingFee());
		BigDecimal products = Money.round(configuration.additionalWeeklyProductsTotal());
		BigDecimal programPortion = configuration.noFeeProgram()
				? Money.ZERO
				: Money.round(net.multiply(configuration.programSplitRatio()));
		BigDecimal escrow = net.subtract(programPortion);
		BigDecimal payment = Money.sum(net, setup, banking, secondary, products);
		BigDecimal balanceAfter = Money.round(balanceBefore.subtract(net));
		return new ScheduleLine(sequenceNumber, paymentDate, payment, setup, programPortion, banking, secondary,
				products, escrow, balanceAfter, ScheduleItemStatus.SCHEDULED);
	}

	/**
	 * Re-splits a row for a new contribution. The row keeps its date, status and fee portions.
	 */
	public ScheduleLine rebalance(ScheduleLine row, BigDecimal contribution, BigDecimal balanceBefore,
								  PlanConfiguration configuration) {
		BigDecimal net = Money.round(contribution);
		BigDecimal programPortion = configuration.noFeeProgram()
				? Money.ZERO
				: Money.round(net.multiply(configuration.programSplitRatio()));
		BigDecimal escrow = net.subtract(programPortion);
		BigDecimal payment = Money.sum(net, row.setupFeePortion(), row.bankingFeePortion(),
				row.secondaryBankingFeePortion(), row.additionalProductsPortion());
		return new ScheduleLine(row.sequenceNumber(), row.paymentDate(), payment, row.setupFeePortion(), programPortion,
				row.bankingFeePortion(), row.secondaryBankingFeePortion(), row.additionalProductsPortion(), escrow,
				Money.round(balanceBefore.subtract(net)), row.status());
	}

	/**
	 * Builds consecutive rows from per-row contributions. The running balance starts at
	 * {@code startingBalance} and drops by each row's contribution.
	 */
	public List<ScheduleLine> decomposeAll(List<LocalDate> dates,
										   List<BigDecimal> contributions,
										   List<BigDecimal> setupFeePortions,
										   BigDecimal startingBalance,
										   int firstSequenceNumber,
										   PlanConfiguration configuration) {
		if (dates.size() != contributions.size() || dates.size() != setupFeePortions.size()) {
			throw new IllegalArgumentException("Schedule inputs must have the same length");
		}
		List<ScheduleLine> lines = new ArrayList<>(dates.size());
		BigDecimal balance = Money.round(startingBalance);
		for (int i = 0; i < dates.size(); i++) {
			ScheduleLine line = decompose(firstSequenceNumber + i, dates.get(i), contributions.get(i),
					setupFeePortions.get(i), balance, configuration);
			balance = line.runningBalance();
			lines.add(line);
		}
		return lines;
	}

	/**
	 * Spreads {@code total} evenly over {@code count} rows. The last row absorbs the rounding
	 * remainder so the parts sum to the total.
	 */
	public List<BigDecimal> spread(BigDecimal total, int count) {
		List<BigDecimal> parts = new ArrayList<>(Math.max(count, 0));
		if (count <= 0) {
			return parts;
		}
		BigDecimal rounded = Money.round(total);
		BigDecimal share = Money.divide(rounded, BigDecimal.valueOf(count));
		BigDecimal allocated = Money.ZERO;
		for (int i = 0; i < count - 1; i++) {
			parts.add(share);
			allocated = allocated.add(share);
		}
		parts.add(rounded.subtract(allocated));
		return parts;
	}
}
