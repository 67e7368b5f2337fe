package core.crypto;

import java.io.IOException;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.security.spec.ECGenParameterSpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Set;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.exceptions.CryptoException;
import core.exceptions.MalformedDataException;

/**
 * Crypto-only certificate authority operations: create the root, issue a
 * server certificate, decide when a certificate is due for renewal and renew
 * it in place. Nothing here touches the network or the filesystem.
 *
 * Keys are ECDSA P-256. Every certificate validity window starts at the
 * current instant (second precision, as encoded in X.509) and lasts
 * {@link #CertificateDuration} unless configured otherwise.
 */
public class CertificateAuthority
{
  private static final Logger LOGGER = LoggerFactory.getLogger( CertificateAuthority.class );

  public static final Duration CertificateDuration       = Duration.ofDays( 90 );
  public static final int      RenewalThresholdPercent   = 90;
  public static final String   DefaultCommonName         = "postgresql-operator-ca";
  public static final String   DefaultOrganizationalUnit = "postgresql-operator";

  private static final String CURVE          = "secp256r1";
  private static final String SIGNATURE_ALGO = "SHA256withECDSA";

  private final Clock        clock;
  private final Duration     validity;
  private final int          renewalThresholdPercent;
  private final String       commonName;
  private final SecureRandom random = new SecureRandom();

  public CertificateAuthority()
  {
    this( Clock.systemUTC(), CertificateDuration, RenewalThresholdPercent, DefaultCommonName );
  }

  public CertificateAuthority( Clock clock )
  {
    this( clock, CertificateDuration, RenewalThresholdPercent, DefaultCommonName );
  }

  public CertificateAuthority( Clock clock, Duration validity, int renewalThresholdPercent, String commonName )
  {
    if( renewalThresholdPercent <= 0 || renewalThresholdPercent > 100 )
    {
      throw new IllegalArgumentException( "Renewal threshold must be within (0, 100]: " + renewalThresholdPercent );
    }

    this.clock                   = clock;
    this.validity                = validity;
    this.renewalThresholdPercent = renewalThresholdPercent;
    this.commonName              = commonName;

    PemCodec.ensureProvider();
  }

  /**
   * Generates a fresh key and a self-signed CA certificate valid from now.
   */
  public CertificateAuthorityPair createAuthority()
    throws CryptoException
  {
    KeyPair keyPair = generateKeyPair();
    X500Name subject = new X500NameBuilder( BCStyle.INSTANCE ).addRDN( BCStyle.OU, DefaultOrganizationalUnit )
                                                             .addRDN( BCStyle.CN, commonName )
                                                             .build();
    Instant notBefore = now();

    try
    {
      X509v3CertificateBuilder builder = newBuilder( subject, subject, notBefore,
                                                     SubjectPublicKeyInfo.getInstance( keyPair.getPublic().getEncoded() ) );

      builder.addExtension( Extension.basicConstraints, true, new BasicConstraints( true ) );
      builder.addExtension( Extension.keyUsage,         true, new KeyUsage( KeyUsage.keyCertSign | KeyUsage.cRLSign | KeyUsage.digitalSignature ) );

      X509Certificate certificate = sign( builder, keyPair.getPrivate() );

      LOGGER.info( "Created certificate authority {} valid until {}", commonName, certificate.getNotAfter().toInstant() );

      return new CertificateAuthorityPair( PemCodec.encodePrivateKey( keyPair.getPrivate() ),
                                           PemCodec.encodeCertificate( certificate ) );
    }
    catch( IOException e )
    {
      throw new CryptoException( "Failed to build CA certificate extensions", e );
    }
  }

  /**
   * Generates a new key and a certificate for {@code hostname}, signed by
   * the authority's private key.
   */
  public LeafCertificatePair createAndSignPair( CertificateAuthorityPair authority, String hostname )
    throws CryptoException, MalformedDataException
  {
    X509Certificate caCertificate = authority.parseCertificate();
    PrivateKey      caKey         = authority.parsePrivateKey();

    KeyPair  keyPair = generateKeyPair();
    X500Name issuer  = X500Name.getInstance( caCertificate.getSubjectX500Principal().getEncoded() );
    X500Name subject = new X500NameBuilder( BCStyle.INSTANCE ).addRDN( BCStyle.CN, hostname ).build();

    try
    {
      X509v3CertificateBuilder builder = newBuilder( issuer, subject, now(),
                                                     SubjectPublicKeyInfo.getInstance( keyPair.getPublic().getEncoded() ) );

      builder.addExtension( Extension.basicConstraints,       true,  new BasicConstraints( false ) );
      builder.addExtension( Extension.keyUsage,               true,  new KeyUsage( KeyUsage.digitalSignature | KeyUsage.keyEncipherment ) );
      builder.addExtension( Extension.extendedKeyUsage,       false, new ExtendedKeyUsage( KeyPurposeId.id_kp_serverAuth ) );
      builder.addExtension( Extension.subjectAlternativeName, false, new GeneralNames( new GeneralName( GeneralName.dNSName, hostname ) ) );

      X509Certificate certificate = sign( builder, caKey );

      LOGGER.info( "Issued server certificate for {} valid until {}", hostname, certificate.getNotAfter().toInstant() );

      return new LeafCertificatePair( PemCodec.encodePrivateKey( keyPair.getPrivate() ),
                                      PemCodec.encodeCertificate( certificate ),
                                      hostname );
    }
    catch( IOException e )
    {
      throw new CryptoException( "Failed to build server certificate extensions for " + hostname, e );
    }
  }

  /**
   * True once the elapsed share of the certificate validity reaches the
   * renewal threshold, or when the certificate is not yet valid.
   */
  public boolean isExpiring( TlsKeyPair pair )
    throws MalformedDataException
  {
    X509Certificate certificate = pair.parseCertificate();
    Instant         now         = clock.instant();
    Instant         notBefore   = certificate.getNotBefore().toInstant();
    Instant         notAfter    = certificate.getNotAfter().toInstant();

    if( now.isBefore( notBefore ) )
    {
      return true;
    }

    long total   = Duration.between( notBefore, notAfter ).toMillis();
    long elapsed = Duration.between( notBefore, now ).toMillis();

    return elapsed * 100 >= total * renewalThresholdPercent;
  }

  /**
   * Reissues the pair's certificate for the same subject, issuer, public key
   * and extensions with a validity window anchored at now, signed with
   * {@code signingKey}. The pair's certificate is replaced in place.
   */
  public void renewCertificate( TlsKeyPair pair, PrivateKey signingKey )
    throws CryptoException, MalformedDataException
  {
    X509CertificateHolder old = PemCodec.decodeCertificateHolder( pair.getCertificate() );

    X509v3CertificateBuilder builder = newBuilder( old.getIssuer(), old.getSubject(), now(), old.getSubjectPublicKeyInfo() );

    @SuppressWarnings( "unchecked" )
    Set<ASN1ObjectIdentifier> critical = old.getCriticalExtensionOIDs();

    try
    {
      for( Object oid : old.getExtensionOIDs() )
      {
        ASN1ObjectIdentifier extOid = (ASN1ObjectIdentifier)oid;
        builder.copyAndAddExtension( extOid, critical.contains( extOid ), old );
      }
    }
    catch( RuntimeException e )
    {
      throw new CryptoException( "Failed to copy certificate extensions of " + old.getSubject(), e );
    }

    X509Certificate renewed = sign( builder, signingKey );
    pair.setCertificate( PemCodec.encodeCertificate( renewed ) );

    LOGGER.info( "Renewed certificate {} valid until {}", old.getSubject(), renewed.getNotAfter().toInstant() );
  }

  private X509v3CertificateBuilder newBuilder( X500Name issuer, X500Name subject, Instant notBefore, SubjectPublicKeyInfo publicKey )
  {
    Instant notAfter = notBefore.plus( validity );

    return new X509v3CertificateBuilder( issuer,
                                         new BigInteger( 127, random ).add( BigInteger.ONE ),
                                         Date.from( notBefore ),
                                         Date.from( notAfter ),
                                         subject,
                                         publicKey );
  }

  private X509Certificate sign( X509v3CertificateBuilder builder, PrivateKey signingKey )
    throws CryptoException
  {
    try
    {
      ContentSigner signer = new JcaContentSignerBuilder( SIGNATURE_ALGO ).setProvider( PemCodec.PROVIDER ).build( signingKey );

      return new JcaX509CertificateConverter().setProvider( PemCodec.PROVIDER ).getCertificate( builder.build( signer ) );
    }
    catch( OperatorCreationException | GeneralSecurityException e )
    {
      throw new CryptoException( "Failed to sign certificate", e );
    }
  }

  private KeyPair generateKeyPair()
    throws CryptoException
  {
    try
    {
      KeyPairGenerator generator = KeyPairGenerator.getInstance( "EC", PemCodec.PROVIDER );
      generator.initialize( new ECGenParameterSpec( CURVE ), random );

      return generator.generateKeyPair();
    }
    catch( GeneralSecurityException e )
    {
      throw new CryptoException( "Failed to generate " + CURVE + " key pair", e );
    }
  }

  private Instant now()
  {
    return clock.instant().truncatedTo( ChronoUnit.SECONDS );
  }
}
