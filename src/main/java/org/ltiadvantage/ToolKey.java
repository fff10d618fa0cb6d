/*  LTI Advantage - A Java library for LTI 1.3 tools
*   Copyright (C) 2026 The LTI Advantage Authors
*   
*   This program is free software: you can redistribute it and/or modify
*   it under the terms of the GNU General Public License as published by
*   the Free Software Foundation, either version 3 of the License, or
*   (at your option) any later version.
*
*   This program is distributed in the hope that it will be useful,
*   but WITHOUT ANY WARRANTY; without even the implied warranty of
*   MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
*   GNU General Public License for more details.
*
*   You should have received a copy of the GNU General Public License
*   along with this program.  If not, see <http://www.gnu.org/licenses/>.
*/

package org.ltiadvantage;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.util.Arrays;
import java.util.Base64;
import java.util.UUID;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * ToolKey - the tool's RSA key pair used to sign client assertions, with the key id (kid)
 * the platform uses to find the matching public key in the tool's JWKS.
 */
public class ToolKey {
	private final String kid;
	private final RSAPrivateKey privateKey;
	private final RSAPublicKey publicKey;

	public ToolKey(String kid, RSAPrivateKey privateKey, RSAPublicKey publicKey) {
		if (kid == null || kid.isEmpty()) throw new IllegalArgumentException("A key id is required.");
		this.kid = kid;
		this.privateKey = privateKey;
		this.publicKey = publicKey;
	}

	/** Generates a fresh 2048-bit key pair with a random kid. */
	public static ToolKey generate() {
		try {
			KeyPairGenerator keyGen = KeyPairGenerator.getInstance("RSA");
			keyGen.initialize(2048);
			KeyPair keyPair = keyGen.genKeyPair();
			return new ToolKey(UUID.randomUUID().toString(), (RSAPrivateKey) keyPair.getPrivate(), (RSAPublicKey) keyPair.getPublic());
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("RSA is not available in this JVM.", e);
		}
	}

	/**
	 * Reads a PEM encoded RSA private key, either PKCS#8 ("BEGIN PRIVATE KEY") or
	 * PKCS#1 ("BEGIN RSA PRIVATE KEY"). The public key is derived from the private key.
	 */
	public static ToolKey fromPem(String kid, String pem) throws SigningKeyException {
		if (kid == null || kid.isEmpty()) throw new SigningKeyException("A key id is required for the signing key.");
		if (pem == null || pem.isBlank()) throw new SigningKeyException("The signing key PEM is empty.");
		boolean pkcs1 = pem.contains("BEGIN RSA PRIVATE KEY");
		String base64 = pem.replaceAll("-----[A-Z ]+-----", "").replaceAll("\\s", "");
		try {
			byte[] der = Base64.getDecoder().decode(base64);
			if (pkcs1) der = pkcs1ToPkcs8(der);
			KeyFactory factory = KeyFactory.getInstance("RSA");
			RSAPrivateCrtKey privateKey = (RSAPrivateCrtKey) factory.generatePrivate(new PKCS8EncodedKeySpec(der));
			RSAPublicKey publicKey = (RSAPublicKey) factory.generatePublic(new RSAPublicKeySpec(privateKey.getModulus(), privateKey.getPublicExponent()));
			return new ToolKey(kid, privateKey, publicKey);
		} catch (IllegalArgumentException | GeneralSecurityException | ClassCastException e) {
			throw new SigningKeyException("The signing key " + kid + " is not a valid RSA private key.", e);
		}
	}

	// wraps a PKCS#1 RSAPrivateKey in a PKCS#8 PrivateKeyInfo with the rsaEncryption algorithm identifier
	static byte[] pkcs1ToPkcs8(byte[] pkcs1) {
		byte[] algorithm = {0x30, 0x0d, 0x06, 0x09, 0x2a, (byte) 0x86, 0x48, (byte) 0x86, (byte) 0xf7, 0x0d, 0x01, 0x01, 0x01, 0x05, 0x00};
		byte[] version = {0x02, 0x01, 0x00};
		ByteArrayOutputStream body = new ByteArrayOutputStream();
		body.writeBytes(version);
		body.writeBytes(algorithm);
		body.write(0x04);
		body.writeBytes(derLength(pkcs1.length));
		body.writeBytes(pkcs1);
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		out.write(0x30);
		out.writeBytes(derLength(body.size()));
		out.writeBytes(body.toByteArray());
		return out.toByteArray();
	}

	static byte[] derLength(int length) {
		if (length < 0x80) return new byte[] {(byte) length};
		byte[] bytes = BigInteger.valueOf(length).toByteArray();
		if (bytes[0] == 0) bytes = Arrays.copyOfRange(bytes, 1, bytes.length);
		byte[] encoded = new byte[bytes.length + 1];
		encoded[0] = (byte) (0x80 | bytes.length);
		System.arraycopy(bytes, 0, encoded, 1, bytes.length);
		return encoded;
	}

	public String getKid() {
		return kid;
	}

	public RSAPrivateKey getPrivateKey() {
		return privateKey;
	}

	public RSAPublicKey getPublicKey() {
		return publicKey;
	}

	/** The public key as a single JWK. */
	public JsonObject toJwk() {
		JsonObject jwk = new JsonObject();
		jwk.addProperty("kty", "RSA");
		jwk.addProperty("kid", kid);
		jwk.addProperty("n", base64Url(publicKey.getModulus()));
		jwk.addProperty("e", base64Url(publicKey.getPublicExponent()));
		jwk.addProperty("alg", "RS256");
		jwk.addProperty("use", "sig");
		return jwk;
	}

	/** The public key as a JSON Web Key Set with one entry. */
	public JsonObject toJwks() {
		JsonObject json = new JsonObject();
		JsonArray keys = new JsonArray();
		keys.add(toJwk());
		json.add("keys", keys);
		return json;
	}

	// JWK integers are unsigned big-endian, so the sign byte of BigInteger.toByteArray() is dropped
	static String base64Url(BigInteger value) {
		byte[] bytes = value.toByteArray();
		if (bytes.length > 1 && bytes[0] == 0) bytes = Arrays.copyOfRange(bytes, 1, bytes.length);
		return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
	}
}
