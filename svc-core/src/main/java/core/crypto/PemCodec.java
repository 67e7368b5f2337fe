package core.crypto;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.Security;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;

import core.exceptions.CryptoException;
import core.exceptions.MalformedDataException;

/**
 * PEM encoding and decoding of certificates and EC private keys.
 */
public final class PemCodec
{
  public static final String PROVIDER = BouncyCastleProvider.PROVIDER_NAME;

  static
  {
    ensureProvider();
  }

  private PemCodec()
  {
  }

  public static Provider ensureProvider()
  {
    Provider provider = Security.getProvider( PROVIDER );
    if( provider == null )
    {
      provider = new BouncyCastleProvider();
      Security.addProvider( provider );
    }
    return provider;
  }

  public static byte[] encodeCertificate( X509Certificate certificate )
    throws CryptoException
  {
    return encode( certificate, "certificate" );
  }

  public static byte[] encodePrivateKey( PrivateKey privateKey )
    throws CryptoException
  {
    return encode( privateKey, "private key" );
  }

  private static byte[] encode( Object object, String what )
    throws CryptoException
  {
    StringWriter sw = new StringWriter();
    try( JcaPEMWriter writer = new JcaPEMWriter( sw ) )
    {
      writer.writeObject( object );
    }
    catch( IOException e )
    {
      throw new CryptoException( "Failed to PEM encode " + what, e );
    }
    return sw.toString().getBytes( StandardCharsets.US_ASCII );
  }

  public static X509CertificateHolder decodeCertificateHolder( byte[] pem )
    throws MalformedDataException
  {
    Object object = readPemObject( pem, "certificate" );

    if( !( object instanceof X509CertificateHolder ) )
    {
      throw new MalformedDataException( "PEM data does not hold a certificate: " + object.getClass().getSimpleName() );
    }
    return (X509CertificateHolder)object;
  }

  public static X509Certificate decodeCertificate( byte[] pem )
    throws MalformedDataException
  {
    X509CertificateHolder holder = decodeCertificateHolder( pem );
    try
    {
      return new JcaX509CertificateConverter().setProvider( PROVIDER ).getCertificate( holder );
    }
    catch( CertificateException e )
    {
      throw new MalformedDataException( "Unable to convert certificate", e );
    }
  }

  public static PrivateKey decodePrivateKey( byte[] pem )
    throws MalformedDataException
  {
    Object             object    = readPemObject( pem, "private key" );
    JcaPEMKeyConverter converter = new JcaPEMKeyConverter().setProvider( PROVIDER );

    try
    {
      if( object instanceof PEMKeyPair )
      {
        return converter.getPrivateKey( ( (PEMKeyPair)object ).getPrivateKeyInfo() );
      }

      if( object instanceof PrivateKeyInfo )
      {
        return converter.getPrivateKey( (PrivateKeyInfo)object );
      }
    }
    catch( IOException e )
    {
      throw new MalformedDataException( "Unable to convert private key", e );
    }

    if( object instanceof PEMEncryptedKeyPair )
    {
      throw new MalformedDataException( "Encrypted private keys not supported" );
    }
    throw new MalformedDataException( "PEM data does not hold a private key: " + object.getClass().getSimpleName() );
  }

  private static Object readPemObject( byte[] pem, String what )
    throws MalformedDataException
  {
    if( pem == null || pem.length == 0 )
    {
      throw new MalformedDataException( "Missing " + what + " data" );
    }

    try( PEMParser parser = new PEMParser( new StringReader( new String( pem, StandardCharsets.US_ASCII ) ) ) )
    {
      Object object = parser.readObject();
      if( object == null )
      {
        throw new MalformedDataException( "No PEM object in " + what + " data" );
      }
      return object;
    }
    catch( IOException | RuntimeException e )
    {
      throw new MalformedDataException( "Unable to parse " + what + " PEM data", e );
    }
  }
}
