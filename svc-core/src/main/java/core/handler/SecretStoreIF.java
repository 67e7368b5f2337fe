package core.handler;

import core.exceptions.ConflictException;
import core.exceptions.NotFoundException;
import core.exceptions.StoreException;
import core.model.SecretRecord;

/**
 * Named byte-map records with optimistic concurrency on update.
 */
public interface SecretStoreIF
{
  public SecretRecord get( String namespace, String name )
    throws NotFoundException, StoreException;

  public SecretRecord create( SecretRecord record )
    throws ConflictException, StoreException;

  /**
   * Replaces the record. Fails with {@link ConflictException} when the
   * record's resourceVersion is no longer the stored one.
   */
  public SecretRecord update( SecretRecord record )
    throws ConflictException, StoreException;
}
