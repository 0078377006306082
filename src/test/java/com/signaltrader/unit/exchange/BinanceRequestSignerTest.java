package com.signaltrader.unit.exchange;

import static org.assertj.core.api.Assertions.assertThat;

import com.signaltrader.exchange.binance.BinanceRequestSigner;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BinanceRequestSignerTest {

    // Published example key pair from the Binance API documentation
    private static final String SECRET = "NhqPtmdSJYdKjVHjA7PZj4Mge3R5YNiP1e3UZjInClVN65XAbvqqM6A7H5fATj0j";

    @Test
    void sign_matchesDocumentedSignature() {
        String query = "symbol=LTCBTC&side=BUY&type=LIMIT&timeInForce=GTC&quantity=1&price=0.1"
                + "&recvWindow=5000&timestamp=1499827319559";

        assertThat(new BinanceRequestSigner(SECRET).sign(query))
                .isEqualTo("c8db56825ae71d6d79447849e617115f4a920fa2acdcab2b053c4b2838bd6b71");
    }

    @Test
    void signedQuery_keepsParameterOrderAndAppendsSignature() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", "BTCUSDT");
        params.put("newClientOrderId", "st-btcu-1 2");

        String signed = new BinanceRequestSigner(SECRET).signedQuery(params);

        assertThat(signed).startsWith("symbol=BTCUSDT&newClientOrderId=st-btcu-1+2&signature=");
        assertThat(signed.substring(signed.indexOf("signature=") + 10)).hasSize(64);
    }
}
