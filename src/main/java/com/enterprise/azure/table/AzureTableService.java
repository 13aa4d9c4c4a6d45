package com.enterprise.azure.table;

import com.azure.data.tables.TableClient;
import com.azure.data.tables.TableServiceClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Table storage access by logical table name.
 *
 * Table names may only contain letters and digits, so every other character
 * is dropped.
 */
@Service
@ConditionalOnProperty(prefix = "azure.storage", name = "connection-string")
@RequiredArgsConstructor
@Slf4j
public class AzureTableService {

    private static final Pattern ILLEGAL_CHARACTERS = Pattern.compile("[^a-zA-Z0-9]");

    private final TableServiceClient tableServiceClient;

    public static String cleanseTableName(String tableName) {
        return ILLEGAL_CHARACTERS.matcher(tableName).replaceAll("");
    }

    public TableClient getTable(String tableName) {
        return getTable(tableName, true);
    }

    public TableClient getTable(String tableName, boolean createIfNotExists) {
        String cleansedTableName = cleanseTableName(tableName);

        if (createIfNotExists) {
            log.debug("Ensuring table exists: table={}", cleansedTableName);
            tableServiceClient.createTableIfNotExists(cleansedTableName);
        }
        return tableServiceClient.getTableClient(cleansedTableName);
    }
}
