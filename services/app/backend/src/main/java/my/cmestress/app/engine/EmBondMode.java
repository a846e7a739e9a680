package my.cmestress.app.engine;

public enum EmBondMode {
	/** USD-denominated: priced off the US curve, deflated with US inflation. */
	HARD_CURRENCY,
	/** Local-currency: the supplied inflation carries an extra EM premium. */
	LOCAL_CURRENCY
}
