package com.campuseats.orderservice.gateway;

import com.campuseats.orderservice.config.PaymentGatewayProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Checks the signature the gateway attaches to a completed payment:
 * hex(HMAC-SHA256(keySecret, gatewayOrderId + "|" + paymentId)).
 */
@Component
@RequiredArgsConstructor
public class PaymentSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    private final PaymentGatewayProperties properties;

    public boolean verify(String gatewayOrderId, String paymentId, String signature) {
        if (gatewayOrderId == null || paymentId == null || signature == null) {
            return false;
        }
        byte[] expected = sign(gatewayOrderId + "|" + paymentId).getBytes(StandardCharsets.UTF_8);
        byte[] actual = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
        // MessageDigest.isEqual doesn't stop at the first differing byte
        return MessageDigest.isEqual(expected, actual);
    }

    String sign(String payload) {
        String secret = properties.getKeySecret();
        if (secret == null || secret.isEmpty()) {
            throw new IllegalStateException("Payment gateway key secret is not configured");
        }
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }
}
