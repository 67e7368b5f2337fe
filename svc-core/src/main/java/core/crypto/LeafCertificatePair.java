package core.crypto;

import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.bouncycastle.asn1.x509.GeneralName;

import core.exceptions.MalformedDataException;
import core.model.SecretRecord;
import core.model.ServiceCoreIF;

/**
 * Server certificate presented by the webhook endpoint, signed by the
 * current authority key.
 */
public class LeafCertificatePair extends TlsKeyPair
{
  private final String subjectHostname;

  public LeafCertificatePair( byte[] privateKey, byte[] certificate, String subjectHostname )
  {
    super( privateKey, certificate );
    this.subjectHostname = subjectHostname;
  }

  public String getSubjectHostname()
  {
    return subjectHostname;
  }

  public static LeafCertificatePair fromSecret( SecretRecord secret )
    throws MalformedDataException
  {
    byte[] key  = requireField( secret, ServiceCoreIF.TlsKeyKey  );
    byte[] cert = requireField( secret, ServiceCoreIF.TlsCertKey );

    return new LeafCertificatePair( key, cert, dnsName( PemCodec.decodeCertificate( cert ) ) );
  }

  private static String dnsName( X509Certificate certificate )
    throws MalformedDataException
  {
    try
    {
      Collection<List<?>> names = certificate.getSubjectAlternativeNames();
      if( names != null )
      {
        for( List<?> entry : names )
        {
          if( entry.size() >= 2 && Integer.valueOf( GeneralName.dNSName ).equals( entry.get( 0 ) ) )
          {
            return (String)entry.get( 1 );
          }
        }
      }
      return null;
    }
    catch( CertificateParsingException e )
    {
      throw new MalformedDataException( "Unable to read subject alternative names", e );
    }
  }

  @Override
  public SecretRecord toSecret( String namespace, String name )
  {
    return new SecretRecord( namespace, name, Map.of( ServiceCoreIF.TlsCertKey, getCertificate(),
                                                      ServiceCoreIF.TlsKeyKey,  getPrivateKey() ) );
  }
}
