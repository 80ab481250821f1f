package ou.capstone.goniometry;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class AngleAppArgParsingTest
{
    private AngleApp.ExitHandler exitHandler;

    @BeforeEach
    public void setUp()
    {
        exitHandler = mock( AngleApp.ExitHandler.class );
        AngleApp.setExitHandler( exitHandler );
    }

    @Test
    public void testNoArgs() throws Exception
    {
        final String[] params = {};
        AngleApp.main( params );
        // Should just print help and exit with return code of zero
        verify( exitHandler ).exit( 0 );
    }

    @Test
    public void testHelp() throws Exception
    {
        final String[] params = { "--help" };
        AngleApp.main( params );
        verify( exitHandler ).exit( 0 );
    }

    @Test
    public void testMissingInputThrowsException()
    {
        assertThrows( ParseException.class, () -> {
            // a second angle but nothing to add it to
            final String[] params = { "--sum", "10°" };
            AngleApp.main( params );
        } );
    }

    @Test
    public void testTwoInputsThrowsException()
    {
        assertThrows( ParseException.class, () -> {
            final String[] params = { "-s", "10°", "-d", "12.5" };
            AngleApp.main( params );
        } );
    }

    @Test
    public void testBothSumsThrowsException()
    {
        assertThrows( ParseException.class, () -> {
            final String[] params = { "-d", "12.5", "--sum", "10°", "--abs-sum", "10°" };
            AngleApp.main( params );
        } );
    }

    @Test
    public void testMissingDecimalArgThrowsException()
    {
        assertThrows( ParseException.class, () -> {
            final String[] params = { "--decimal" };
            AngleApp.main( params );
        } );
    }

    @Test
    public void testUnsupportedOptions()
    {
        assertThrows( ParseException.class, () -> {
            final String[] params = { "--clowns", "all-of-them" };
            AngleApp.main( params );
        } );
    }

    @Test
    public void testStringInput() throws Exception
    {
        final String[] params = { "-s", "12° 30' 15.5\"" };
        AngleApp.main( params );
        verify( exitHandler, never() ).exit( anyInt() );
    }

    @Test
    public void testDecimalWithSumAsJson() throws Exception
    {
        final String[] params = { "-d", "12.5", "--sum", "10° 15'", "-p", "4", "-f", "json" };
        AngleApp.main( params );
        verify( exitHandler, never() ).exit( anyInt() );
    }

    @Test
    public void testRadianWithAbsSum() throws Exception
    {
        final String[] params = { "--radian", "1.5", "--abs-sum", "45°" };
        AngleApp.main( params );
        verify( exitHandler, never() ).exit( anyInt() );
    }

    @Test
    public void testDecimalOverflowExitsWithError() throws Exception
    {
        final String[] params = { "-d", "400" };
        AngleApp.main( params );
        verify( exitHandler ).exit( 1 );
    }

    @Test
    public void testInvalidNumberExitsWithError() throws Exception
    {
        final String[] params = { "-r", "abc" };
        AngleApp.main( params );
        verify( exitHandler ).exit( 1 );
    }

    @Test
    public void testInvalidAngleTextExitsWithError() throws Exception
    {
        final String[] params = { "-s", "north" };
        AngleApp.main( params );
        verify( exitHandler ).exit( 1 );
    }

    @Test
    public void testInvalidPrecisionExitsWithError() throws Exception
    {
        final String[] params = { "-d", "12.5", "-p", "two" };
        AngleApp.main( params );
        verify( exitHandler ).exit( 1 );
    }
}
