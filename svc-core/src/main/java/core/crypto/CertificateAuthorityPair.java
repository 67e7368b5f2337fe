package core.crypto;

import java.util.Map;

import core.exceptions.MalformedDataException;
import core.model.SecretRecord;
import core.model.ServiceCoreIF;

/**
 * The self-signed root whose key signs the webhook server certificate.
 */
public class CertificateAuthorityPair extends TlsKeyPair
{
  public CertificateAuthorityPair( byte[] privateKey, byte[] certificate )
  {
    super( privateKey, certificate );
  }

  public static CertificateAuthorityPair fromSecret( SecretRecord secret )
    throws MalformedDataException
  {
    return new CertificateAuthorityPair( requireField( secret, ServiceCoreIF.CaKeyKey ),
                                         requireField( secret, ServiceCoreIF.CaCertKey ) );
  }

  @Override
  public SecretRecord toSecret( String namespace, String name )
  {
    return new SecretRecord( namespace, name, Map.of( ServiceCoreIF.CaCertKey, getCertificate(),
                                                      ServiceCoreIF.CaKeyKey,  getPrivateKey() ) );
  }
}
