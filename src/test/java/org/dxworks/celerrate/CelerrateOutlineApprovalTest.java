package org.dxworks.celerrate;

import org.approvaltests.Approvals;
import org.dxworks.celerrate.dialect.Dialect;
import org.dxworks.celerrate.mapper.MappingResult;
import org.dxworks.celerrate.model.AstPrinter;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertTrue;

public class CelerrateOutlineApprovalTest {

    @Test
    void map_PointSample() throws Exception {
        Path file = Paths.get("src/test/resources/samples/php/Point.php");

        MappingResult result = Celerrate.mapFile(file, Dialect.PHP_8_1);

        assertTrue(result.getDiagnostics().isEmpty(), () -> result.getDiagnostics().toString());
        Approvals.verify(AstPrinter.print(result.getRoot()));
    }
}
