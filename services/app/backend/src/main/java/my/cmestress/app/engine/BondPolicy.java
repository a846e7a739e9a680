package my.cmestress.app.engine;

import my.cmestress.app.model.AssetClass;
import my.cmestress.app.model.UnknownIdentifierException;

/**
 * What distinguishes one bond class from another: its credit-loss rule and whether a credit spread reverts
 * toward fair value on top of the term premium.
 */
public record BondPolicy(AssetClass assetClass, CreditLossPolicy creditLoss, boolean creditSpreadReversion) {
	public static final BondPolicy GOVERNMENT = new BondPolicy(AssetClass.BONDS_GLOBAL, CreditLossPolicy.NONE, false);
	public static final BondPolicy HIGH_YIELD = new BondPolicy(AssetClass.BONDS_HY, CreditLossPolicy.EXPECTED_DEFAULT_LOSS, true);
	public static final BondPolicy EMERGING = new BondPolicy(AssetClass.BONDS_EM, CreditLossPolicy.EXPECTED_DEFAULT_LOSS, false);

	public static BondPolicy forAssetClass(AssetClass assetClass) {
		return switch (assetClass) {
			case BONDS_GLOBAL -> GOVERNMENT;
			case BONDS_HY -> HIGH_YIELD;
			case BONDS_EM -> EMERGING;
			default -> throw new UnknownIdentifierException("bond class", assetClass.getKey());
		};
	}
}
