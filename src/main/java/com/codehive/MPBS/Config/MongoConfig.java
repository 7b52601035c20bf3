package com.codehive.MPBS.Config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.ReadPreference;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.AbstractMongoClientConfiguration;

@Configuration
public class MongoConfig extends AbstractMongoClientConfiguration {

    @Value("${spring.data.mongodb.uri:mongodb://localhost:27017/MPBS_DB}")
    private String mongoUri;

    @Value("${spring.data.mongodb.database:MPBS_DB}")
    private String databaseName;

    @Override
    protected String getDatabaseName() {
        String dbName = (databaseName != null) ? databaseName.trim() : null;
        return (dbName != null && !dbName.isEmpty()) ? dbName : "MPBS_DB";
    }

    @Override
    public MongoClient mongoClient() {
        // Occupancy checks must see the latest write, so reads stay on the primary
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(mongoUri))
                .readPreference(ReadPreference.primary())
                .build();

        return MongoClients.create(settings);
    }

    // Creates slot_period_idx and the username index on startup
    @Override
    protected boolean autoIndexCreation() {
        return true;
    }
}
