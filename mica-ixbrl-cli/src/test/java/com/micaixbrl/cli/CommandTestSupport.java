package com.micaixbrl.cli;

import com.micaixbrl.MicaIxbrlCLI;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs CLI commands in-process and captures their output.
 */
final class CommandTestSupport {

    static final String VALID_RECORD = """
        {
          "tokenType": "OTHR",
          "documentDate": "2025-01-15",
          "language": "en",
          "partA": {
            "legalName": "Example Labs Ltd",
            "lei": "529900T8BM49AURSDO55",
            "registeredAddress": "12 Republic Street, Valletta, Malta",
            "country": "MT",
            "website": "https://example-labs.eu",
            "contactEmail": "info@example-labs.eu"
          },
          "partD": {
            "cryptoAssetName": "Example Token",
            "cryptoAssetSymbol": "EXT",
            "totalSupply": 1000000,
            "tokenStandard": "ERC-20",
            "blockchainNetwork": "Ethereum",
            "consensusMechanism": "Proof of Stake",
            "projectDescription": "A utility token granting access to the Example data marketplace."
          },
          "partE": {
            "isPublicOffering": true,
            "publicOfferingStartDate": "2025-02-01",
            "publicOfferingEndDate": "2025-03-31",
            "tokenPrice": 0.10,
            "tokenPriceCurrency": "EUR"
          },
          "partH": {
            "blockchainDescription": "Ethereum mainnet, a public permissionless ledger."
          },
          "partJ": {
            "energyConsumption": 1200,
            "energyUnit": "kWh",
            "consensusMechanismType": "Proof of Stake"
          }
        }
        """;

    static final String MISSING_LEI_RECORD = """
        {
          "partA": { "legalName": "Example Labs Ltd", "country": "MT" },
          "partD": { "cryptoAssetName": "Example Token", "cryptoAssetSymbol": "EXT" }
        }
        """;

    private CommandTestSupport() {
        // Utility class
    }

    static Path writeRecord(Path directory, String name, String content) throws IOException {
        Path file = directory.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    static Result execute(String... args) {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine commandLine = MicaIxbrlCLI.createCommandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        int exitCode = commandLine.execute(args);
        return new Result(exitCode, out.toString(), err.toString());
    }

    record Result(int exitCode, String out, String err) {}
}
