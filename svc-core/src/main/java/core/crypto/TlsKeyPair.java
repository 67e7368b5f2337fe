package core.crypto;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.time.Instant;

import core.exceptions.MalformedDataException;
import core.model.SecretRecord;

/**
 * A PEM encoded private key together with the certificate issued for it.
 * The certificate is replaced in place when renewed; the key never changes.
 */
public abstract class TlsKeyPair
{
  private final byte[] privateKey;
  private byte[]       certificate;

  protected TlsKeyPair( byte[] privateKey, byte[] certificate )
  {
    this.privateKey  = privateKey.clone();
    this.certificate = certificate.clone();
  }

  public byte[] getPrivateKey()
  {
    return privateKey.clone();
  }

  public byte[] getCertificate()
  {
    return certificate.clone();
  }

  void setCertificate( byte[] certificate )
  {
    this.certificate = certificate.clone();
  }

  public PrivateKey parsePrivateKey()
    throws MalformedDataException
  {
    return PemCodec.decodePrivateKey( privateKey );
  }

  public X509Certificate parseCertificate()
    throws MalformedDataException
  {
    return PemCodec.decodeCertificate( certificate );
  }

  public Instant getNotBefore()
    throws MalformedDataException
  {
    return parseCertificate().getNotBefore().toInstant();
  }

  public Instant getNotAfter()
    throws MalformedDataException
  {
    return parseCertificate().getNotAfter().toInstant();
  }

  /**
   * Builds the secret holding this pair under its conventional field names.
   */
  public abstract SecretRecord toSecret( String namespace, String name );

  protected static byte[] requireField( SecretRecord secret, String key )
    throws MalformedDataException
  {
    byte[] value = secret.getData( key );
    if( value == null || value.length == 0 )
    {
      throw new MalformedDataException( "Secret " + secret.getNamespace() + "/" + secret.getName() + " has no '" + key + "' entry" );
    }
    return value;
  }
}
