package core.crypto;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import core.exceptions.MalformedDataException;
import core.model.SecretRecord;
import core.model.ServiceCoreIF;

public class CertificateAuthorityTest
{
  private static final Instant T0       = Instant.parse( "2026-03-01T10:00:00Z" );
  private static final String  HOSTNAME = "pg-webhook.pg-system.svc";

  private MutableClock         clock;
  private CertificateAuthority authority;

  @BeforeEach
  public void setUp()
  {
    clock     = new MutableClock( T0 );
    authority = new CertificateAuthority( clock );
  }

  @Test
  public void authorityIsValidForNinetyDaysFromNow()
    throws Exception
  {
    CertificateAuthorityPair ca = authority.createAuthority();

    assertThat( ca.getNotBefore(), is( T0 ) );
    assertThat( ca.getNotAfter(), is( T0.plus( Duration.ofDays( 90 ) ) ) );

    X509Certificate cert = ca.parseCertificate();
    assertThat( cert.getBasicConstraints() >= 0, is( true ) );
    assertThat( cert.getSubjectX500Principal().getName(), containsString( "CN=" + CertificateAuthority.DefaultCommonName ) );
    cert.verify( cert.getPublicKey() );
  }

  @Test
  public void isExpiringFlipsExactlyAtNinetyPercentOfValidity()
    throws Exception
  {
    CertificateAuthorityPair ca = authority.createAuthority();

    // 90% of 90 days is 81 days
    clock.setInstant( T0.plus( Duration.ofDays( 81 ) ).minusSeconds( 1 ) );
    assertThat( authority.isExpiring( ca ), is( false ) );

    clock.setInstant( T0.plus( Duration.ofDays( 81 ) ) );
    assertThat( authority.isExpiring( ca ), is( true ) );

    clock.setInstant( T0.plus( Duration.ofDays( 100 ) ) );
    assertThat( authority.isExpiring( ca ), is( true ) );
  }

  @Test
  public void notYetValidCertificateIsExpiring()
    throws Exception
  {
    CertificateAuthorityPair ca = authority.createAuthority();

    clock.setInstant( T0.minusSeconds( 1 ) );
    assertThat( authority.isExpiring( ca ), is( true ) );

    clock.setInstant( T0 );
    assertThat( authority.isExpiring( ca ), is( false ) );
  }

  @Test
  public void decodedAuthorityCanSignVerifiableLeaf()
    throws Exception
  {
    CertificateAuthorityPair ca     = authority.createAuthority();
    SecretRecord             secret = ca.toSecret( "pg-system", "pg-ca" );

    CertificateAuthorityPair decoded = CertificateAuthorityPair.fromSecret( secret );
    LeafCertificatePair      leaf    = authority.createAndSignPair( decoded, HOSTNAME );

    X509Certificate leafCert = leaf.parseCertificate();
    leafCert.verify( decoded.parseCertificate().getPublicKey() );

    assertThat( leafCert.getBasicConstraints(), is( -1 ) );
    assertThat( leafCert.getIssuerX500Principal(), is( decoded.parseCertificate().getSubjectX500Principal() ) );
    assertThat( leafCert.getExtendedKeyUsage().contains( "1.3.6.1.5.5.7.3.1" ), is( true ) );
    assertThat( leaf.getSubjectHostname(), is( HOSTNAME ) );

    LeafCertificatePair reread = LeafCertificatePair.fromSecret( leaf.toSecret( "pg-system", "pg-webhook-cert" ) );
    assertThat( reread.getSubjectHostname(), is( HOSTNAME ) );
    assertArrayEquals( leaf.getCertificate(), reread.getCertificate() );
  }

  @Test
  public void renewalKeepsKeySubjectAndExtensions()
    throws Exception
  {
    CertificateAuthorityPair ca  = authority.createAuthority();
    X509Certificate          old = ca.parseCertificate();
    byte[]                   key = ca.getPrivateKey();

    clock.advance( Duration.ofDays( 85 ) );
    assertThat( authority.isExpiring( ca ), is( true ) );

    authority.renewCertificate( ca, ca.parsePrivateKey() );
    X509Certificate renewed = ca.parseCertificate();

    assertArrayEquals( key, ca.getPrivateKey() );
    assertThat( renewed.getPublicKey(), is( old.getPublicKey() ) );
    assertThat( renewed.getSubjectX500Principal(), is( old.getSubjectX500Principal() ) );
    assertThat( renewed.getSerialNumber(), is( not( old.getSerialNumber() ) ) );
    assertThat( renewed.getBasicConstraints(), is( old.getBasicConstraints() ) );
    assertThat( renewed.getNotBefore().toInstant(), is( T0.plus( Duration.ofDays( 85 ) ) ) );
    assertThat( authority.isExpiring( ca ), is( false ) );

    renewed.verify( old.getPublicKey() );
  }

  @Test
  public void renewedLeafIsSignedByGivenAuthorityKey()
    throws Exception
  {
    CertificateAuthorityPair ca   = authority.createAuthority();
    LeafCertificatePair      leaf = authority.createAndSignPair( ca, HOSTNAME );

    clock.advance( Duration.ofDays( 82 ) );
    authority.renewCertificate( leaf, ca.parsePrivateKey() );

    X509Certificate renewed = leaf.parseCertificate();
    renewed.verify( ca.parseCertificate().getPublicKey() );
    assertThat( (String)renewed.getSubjectAlternativeNames().iterator().next().get( 1 ), is( HOSTNAME ) );
  }

  @Test
  public void missingSecretFieldIsMalformed()
  {
    SecretRecord secret = new SecretRecord( "pg-system", "pg-ca", Map.of( ServiceCoreIF.CaCertKey, new byte[] { 1 } ) );

    assertThrows( MalformedDataException.class, () -> CertificateAuthorityPair.fromSecret( secret ) );
  }

  @Test
  public void thresholdMustBeAPercentage()
  {
    assertThrows( IllegalArgumentException.class,
                  () -> new CertificateAuthority( clock, Duration.ofDays( 1 ), 0, "x" ) );
    assertThrows( IllegalArgumentException.class,
                  () -> new CertificateAuthority( clock, Duration.ofDays( 1 ), 101, "x" ) );
  }
}
