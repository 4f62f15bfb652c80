package dev.quorum.infrastructure.github;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPrivateKey;
import java.security.spec.KeySpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPrivateCrtKeySpec;
import java.util.Base64;

/**
 * Reads a GitHub App private key. GitHub issues PKCS#1 ("BEGIN RSA PRIVATE KEY"),
 * which the JDK cannot read directly, so that form is unpacked from DER here.
 */
final class PemPrivateKeys {

    private PemPrivateKeys() {}

    static RSAPrivateKey parse(String pem) {
        boolean pkcs1 = pem.contains("BEGIN RSA PRIVATE KEY");
        String base64 = pem.replaceAll("-----(BEGIN|END) (RSA )?PRIVATE KEY-----", "").replaceAll("\\s", "");
        try {
            byte[] der = Base64.getDecoder().decode(base64);
            KeySpec spec = pkcs1 ? new DerReader(der).rsaPrivateKey() : new PKCS8EncodedKeySpec(der);
            return (RSAPrivateKey) KeyFactory.getInstance("RSA").generatePrivate(spec);
        } catch (GeneralSecurityException | IllegalArgumentException | IndexOutOfBoundsException e) {
            throw new IllegalStateException("GitHub App private key is not a readable RSA PEM", e);
        }
    }

    /**
     * RSAPrivateKey ::= SEQUENCE { version, n, e, d, p, q, dP, dQ, qInv }
     */
    private static final class DerReader {
        private final byte[] der;
        private int pos;

        DerReader(byte[] der) {
            this.der = der;
        }

        RSAPrivateCrtKeySpec rsaPrivateKey() {
            pos++;
            length();
            integer();
            return new RSAPrivateCrtKeySpec(integer(), integer(), integer(), integer(),
                    integer(), integer(), integer(), integer());
        }

        private BigInteger integer() {
            pos++;
            int len = length();
            byte[] value = new byte[len];
            System.arraycopy(der, pos, value, 0, len);
            pos += len;
            return new BigInteger(value);
        }

        private int length() {
            int first = der[pos++] & 0xFF;
            if (first < 0x80) return first;
            int len = 0;
            for (int i = 0; i < (first & 0x7F); i++) {
                len = (len << 8) | (der[pos++] & 0xFF);
            }
            return len;
        }
    }
}
