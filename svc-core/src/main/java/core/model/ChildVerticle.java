package core.model;

/**
 * A verticle deployed by a service main, kept so it can be undeployed in
 * reverse order on shutdown.
 */
public record ChildVerticle( String vertName, String id )
{
}
