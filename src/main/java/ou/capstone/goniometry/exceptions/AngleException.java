package ou.capstone.goniometry.exceptions;

/**
 * Base exception for all angle construction and comparison errors.
 */
public class AngleException extends RuntimeException
{
    public AngleException( final String msg )
    {
        super( msg );
    }

    public AngleException( final String msg, final Throwable cause )
    {
        super( msg, cause );
    }
}
