package core.handler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.PrivateKey;
import java.util.Base64;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;

import io.fabric8.kubernetes.api.model.admissionregistration.v1.WebhookClientConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.crypto.CertificateAuthority;
import core.crypto.CertificateAuthorityPair;
import core.crypto.LeafCertificatePair;
import core.exceptions.ConflictException;
import core.exceptions.MalformedDataException;
import core.exceptions.NotFoundException;
import core.exceptions.ReconcileException;
import core.model.AdmissionConfiguration;
import core.model.SecretRecord;
import core.model.ServiceCoreIF;
import core.model.WebhookKind;

/**
 * Sets up the PKI the operator webhook server needs: makes sure a CA and a
 * server certificate exist and are not about to expire, copies the server
 * certificate to the directory the webhook server reads, and injects the
 * public certificate into the admission webhook configurations.
 *
 * Not thread safe; callers serialize {@link #setup()} runs.
 */
public class WebhookCertificateManager
{
  private static final Logger LOGGER = LoggerFactory.getLogger( WebhookCertificateManager.class );

  private static final EnumSet<PosixFilePermission> OwnerReadWrite = EnumSet.of( PosixFilePermission.OWNER_READ,
                                                                                 PosixFilePermission.OWNER_WRITE );

  private final SecretStoreIF          secretStore;
  private final AdmissionConfigStoreIF admissionStore;
  private final CertificateAuthority   authority;
  private final WebhookEnvironment     webhookEnv;

  public WebhookCertificateManager( SecretStoreIF          secretStore,
                                    AdmissionConfigStoreIF admissionStore,
                                    CertificateAuthority   authority,
                                    WebhookEnvironment     webhookEnv )
  {
    this.secretStore    = secretStore;
    this.admissionStore = admissionStore;
    this.authority      = authority;
    this.webhookEnv     = webhookEnv;
  }

  public WebhookEnvironment getWebhookEnvironment()
  {
    return webhookEnv;
  }

  /**
   * Runs one full maintenance pass. Stops at the first failure, except for
   * missing webhook configurations which are logged and skipped.
   */
  public void setup()
    throws ReconcileException, IOException
  {
    SecretRecord caSecret      = ensureRootCACertificate( webhookEnv.getOperatorNamespace(), webhookEnv.getCaSecretName() );
    SecretRecord webhookSecret = ensureCertificate( caSecret );

    dumpSecretToDir( webhookSecret, webhookEnv.getCertDir() );

    for( WebhookKind kind : WebhookKind.values() )
    {
      String configName = webhookEnv.getWebhookConfigurationName( kind );
      try
      {
        injectPublicKeyIntoWebhook( kind, configName, webhookSecret );
      }
      catch( NotFoundException e )
      {
        LOGGER.info( "{} not found, cannot inject public key - name = {}", kind.getKubeKind(), configName );
      }
    }
  }

  /**
   * Returns the CA secret, creating the authority when absent and renewing
   * its certificate when it is expiring.
   */
  public SecretRecord ensureRootCACertificate( String namespace, String name )
    throws ReconcileException
  {
    SecretRecord secret;
    try
    {
      secret = secretStore.get( namespace, name );
    }
    catch( NotFoundException e )
    {
      LOGGER.info( "CA secret {}/{} not found, creating a new certificate authority", namespace, name );

      CertificateAuthorityPair pair = authority.createAuthority();
      try
      {
        return secretStore.create( pair.toSecret( namespace, name ) );
      }
      catch( ConflictException ce )
      {
        LOGGER.warn( "CA secret {}/{} was created concurrently, using the stored one", namespace, name );
        secret = secretStore.get( namespace, name );
      }
    }

    return renewCACertificate( secret, true );
  }

  private SecretRecord renewCACertificate( SecretRecord secret, boolean retryOnConflict )
    throws ReconcileException
  {
    CertificateAuthorityPair pair = CertificateAuthorityPair.fromSecret( secret );
    if( !authority.isExpiring( pair ) )
    {
      return secret;
    }

    LOGGER.info( "CA certificate in secret {}/{} is expiring, renewing it", secret.getNamespace(), secret.getName() );

    PrivateKey privateKey = pair.parsePrivateKey();
    authority.renewCertificate( pair, privateKey );

    try
    {
      return secretStore.update( secret.withData( ServiceCoreIF.CaCertKey, pair.getCertificate() ) );
    }
    catch( ConflictException e )
    {
      if( !retryOnConflict )
      {
        throw e;
      }

      LOGGER.warn( "CA secret {}/{} changed while renewing, reading it again", secret.getNamespace(), secret.getName() );
      return renewCACertificate( secretStore.get( secret.getNamespace(), secret.getName() ), false );
    }
  }

  /**
   * Returns the webhook server certificate secret, issuing it when absent
   * and renewing it with the CA's current key when it is expiring.
   */
  public SecretRecord ensureCertificate( SecretRecord caSecret )
    throws ReconcileException
  {
    String namespace = webhookEnv.getOperatorNamespace();
    String name      = webhookEnv.getSecretName();

    SecretRecord secret;
    try
    {
      secret = secretStore.get( namespace, name );
    }
    catch( NotFoundException e )
    {
      String hostname = webhookEnv.getWebhookHostname();
      LOGGER.info( "Webhook secret {}/{} not found, issuing a certificate for {}", namespace, name, hostname );

      CertificateAuthorityPair caPair      = CertificateAuthorityPair.fromSecret( caSecret );
      LeafCertificatePair      webhookPair = authority.createAndSignPair( caPair, hostname );
      try
      {
        return secretStore.create( webhookPair.toSecret( namespace, name ) );
      }
      catch( ConflictException ce )
      {
        LOGGER.warn( "Webhook secret {}/{} was created concurrently, using the stored one", namespace, name );
        secret = secretStore.get( namespace, name );
      }
    }

    return renewServerCertificate( caSecret, secret, true );
  }

  private SecretRecord renewServerCertificate( SecretRecord caSecret, SecretRecord secret, boolean retryOnConflict )
    throws ReconcileException
  {
    LeafCertificatePair pair = LeafCertificatePair.fromSecret( secret );
    if( !authority.isExpiring( pair ) )
    {
      return secret;
    }

    LOGGER.info( "Server certificate in secret {}/{} is expiring, renewing it", secret.getNamespace(), secret.getName() );

    // Always sign with the key held by the CA secret passed in, never a cached one
    PrivateKey caPrivateKey = CertificateAuthorityPair.fromSecret( caSecret ).parsePrivateKey();
    authority.renewCertificate( pair, caPrivateKey );

    try
    {
      return secretStore.update( secret.withData( ServiceCoreIF.TlsCertKey, pair.getCertificate() ) );
    }
    catch( ConflictException e )
    {
      if( !retryOnConflict )
      {
        throw e;
      }

      LOGGER.warn( "Webhook secret {}/{} changed while renewing, reading it again", secret.getNamespace(), secret.getName() );
      return renewServerCertificate( caSecret, secretStore.get( secret.getNamespace(), secret.getName() ), false );
    }
  }

  /**
   * Writes every secret entry to a same-named file in {@code certDir}, then
   * records the secret resourceVersion in the {@code resource} file. Does
   * nothing when that file already holds the secret's resourceVersion.
   *
   * @return true when the files were written
   */
  public boolean dumpSecretToDir( SecretRecord secret, Path certDir )
    throws IOException
  {
    String resourceVersion = Objects.toString( secret.getResourceVersion(), "" );
    Path   resourceFile    = certDir.resolve( ServiceCoreIF.ResourceVersionFile );

    if( Files.exists( resourceFile ) )
    {
      String oldVersion = Files.readString( resourceFile, StandardCharsets.UTF_8 );
      if( oldVersion.equals( resourceVersion ) )
      {
        LOGGER.debug( "Certificates in {} already match resourceVersion {}", certDir, resourceVersion );
        return false;
      }
    }

    for( String key : secret.getData().keySet() )
    {
      checkEntryName( certDir, key );
    }

    Files.createDirectories( certDir );

    for( Map.Entry<String, byte[]> entry : secret.getData().entrySet() )
    {
      writeFile( certDir, entry.getKey(), entry.getValue() );
    }

    // Written last: a crash before this point leaves the old version and forces a rewrite
    writeFile( certDir, ServiceCoreIF.ResourceVersionFile, resourceVersion.getBytes( StandardCharsets.UTF_8 ) );

    LOGGER.info( "Wrote {} certificate file(s) from secret {}/{} to {}", secret.getData().size(),
                 secret.getNamespace(), secret.getName(), certDir );
    return true;
  }

  private static void checkEntryName( Path certDir, String key )
    throws IOException
  {
    if( ServiceCoreIF.ResourceVersionFile.equals( key ) )
    {
      throw new IOException( "Secret entry '" + key + "' clashes with the resourceVersion file in " + certDir );
    }

    Path target = certDir.resolve( key ).normalize();
    if( !certDir.normalize().equals( target.getParent() ) )
    {
      throw new IOException( "Refusing to write secret entry outside " + certDir + ": " + key );
    }
  }

  private void writeFile( Path certDir, String fileName, byte[] content )
    throws IOException
  {
    Path finalFile = certDir.resolve( fileName ).normalize();
    Path tempFile  = createOwnerOnlyFile( certDir.resolve( fileName + ".tmp" ) );

    Files.write( tempFile, content, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING );
    Files.move( tempFile, finalFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING );
  }

  /**
   * Creates an empty file readable and writable by the owner only, replacing
   * any leftover from an interrupted run.
   */
  static Path createOwnerOnlyFile( Path file )
    throws IOException
  {
    Files.deleteIfExists( file );
    try
    {
      return Files.createFile( file, PosixFilePermissions.asFileAttribute( OwnerReadWrite ) );
    }
    catch( UnsupportedOperationException e )
    {
      LOGGER.debug( "POSIX file permissions not supported, creating {} with default permissions", file );
      return Files.createFile( file );
    }
  }

  /**
   * Overwrites the CA bundle of every webhook entry in the named
   * configuration with the server certificate held by {@code tlsSecret}.
   *
   * @throws NotFoundException when the configuration does not exist (yet)
   */
  public void injectPublicKeyIntoWebhook( WebhookKind kind, String configName, SecretRecord tlsSecret )
    throws ReconcileException
  {
    byte[] publicCert = tlsSecret.getData( ServiceCoreIF.TlsCertKey );
    if( publicCert == null )
    {
      throw new MalformedDataException( "Secret " + tlsSecret.getName() + " has no '" + ServiceCoreIF.TlsCertKey + "' entry" );
    }
    String caBundle = Base64.getEncoder().encodeToString( publicCert );

    for( int attempt = 1; ; attempt++ )
    {
      AdmissionConfiguration config = admissionStore.get( kind, configName );
      for( WebhookClientConfig clientConfig : config.getClientConfigs() )
      {
        clientConfig.setCaBundle( caBundle );
      }

      try
      {
        admissionStore.update( config );
        return;
      }
      catch( ConflictException e )
      {
        if( attempt >= 2 )
        {
          throw e;
        }
        LOGGER.warn( "{} {} changed while injecting the CA bundle, reading it again", kind.getKubeKind(), configName );
      }
    }
  }
}
