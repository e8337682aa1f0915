package com.rsitrader.exchange;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.stereotype.Component;

@Component
public class SignatureUtil {

	private static final String ALGORITHM = "HmacSHA256";

	public String sign(String payload, String secretKey) {
		try {
			Mac mac = Mac.getInstance(ALGORITHM);
			mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), ALGORITHM));
			byte[] digest = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
			StringBuilder builder = new StringBuilder(digest.length * 2);
			for (byte value : digest) {
				builder.append(String.format("%02x", value));
			}
			return builder.toString();
		} catch (Exception ex) {
			throw new IllegalStateException("Unable to sign payload", ex);
		}
	}

	/**
	 * Joins the parameters in iteration order and appends the HMAC signature of exactly that string.
	 */
	public String signedQuery(Map<String, String> parameters, String secretKey) {
		StringJoiner joiner = new StringJoiner("&");
		parameters.forEach((key, value) -> joiner.add(key + "=" + value));
		String payload = joiner.toString();
		return payload + "&signature=" + sign(payload, secretKey);
	}
}
