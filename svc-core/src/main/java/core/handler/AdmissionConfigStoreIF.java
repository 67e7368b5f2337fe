package core.handler;

import core.exceptions.ConflictException;
import core.exceptions.NotFoundException;
import core.exceptions.StoreException;
import core.model.AdmissionConfiguration;
import core.model.WebhookKind;

public interface AdmissionConfigStoreIF
{
  public AdmissionConfiguration get( WebhookKind kind, String name )
    throws NotFoundException, StoreException;

  public void update( AdmissionConfiguration configuration )
    throws ConflictException, StoreException;
}
