package my.cmestress.app.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssetClassTest {
	@Test
	void keysResolveCaseInsensitively() {
		assertThat(AssetClass.fromKey("Equity_EM")).isEqualTo(AssetClass.EQUITY_EM);
		assertThat(Region.fromKey(" eurozone ")).isEqualTo(Region.EUROZONE);
		assertThat(BaseCurrency.fromKey("EUR")).isEqualTo(BaseCurrency.EUR);
		assertThat(EquityModelType.fromKey("gk")).isEqualTo(EquityModelType.GK);
	}

	@Test
	void unknownKeysAreRejectedWithKind() {
		assertThatThrownBy(() -> AssetClass.fromKey("crypto"))
				.isInstanceOf(UnknownIdentifierException.class)
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Unknown asset class: crypto");
		assertThatThrownBy(() -> BaseCurrency.fromKey("jpy"))
				.isInstanceOf(UnknownIdentifierException.class);
	}

	@Test
	void basePeggedAssetsFollowTheInvestor() {
		assertThat(AssetClass.LIQUIDITY.isBasePegged()).isTrue();
		assertThat(AssetClass.LIQUIDITY.macroRegion(BaseCurrency.EUR)).isEqualTo(Region.EUROZONE);
		assertThat(AssetClass.ABSOLUTE_RETURN.localCurrency(BaseCurrency.USD)).isEqualTo(Currency.USD);
		assertThat(AssetClass.BONDS_EM.localCurrency(BaseCurrency.EUR)).isEqualTo(Currency.USD);
		assertThat(AssetClass.EQUITY_JAPAN.macroRegion(BaseCurrency.EUR)).isEqualTo(Region.JAPAN);
	}
}
