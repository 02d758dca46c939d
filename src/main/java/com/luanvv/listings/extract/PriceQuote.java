package com.luanvv.listings.extract;

import com.luanvv.listings.model.PaymentPeriod;
import java.math.BigDecimal;
import lombok.Value;

@Value
public class PriceQuote {
    public static final PriceQuote ON_REQUEST = new PriceQuote(BigDecimal.ZERO, PaymentPeriod.ON_REQUEST);

    BigDecimal amount;
    PaymentPeriod period;
}
