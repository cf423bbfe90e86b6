package io.backbork.config;

import io.backbork.AccessResolver;
import io.backbork.AuditSink;
import io.backbork.BackupQueue;
import io.backbork.DestinationRegistry;
import io.backbork.ExecutionEngine;
import io.backbork.ProcessLiveness;
import io.backbork.Transport;
import io.backbork.internal.DefaultBackupQueue;
import io.backbork.internal.QueueLock;
import io.backbork.internal.QueueProcessor;
import io.backbork.internal.file.FileStores;
import io.backbork.internal.mongo.MongoStores;
import io.backbork.store.BackborkStores;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for backbork.
 *
 * <p>The request-side {@link BackupQueue} is always available. The {@link QueueProcessor} (and the
 * optional periodic trigger) need the application to provide an {@link ExecutionEngine}, a
 * {@link Transport} and an {@link AccessResolver}.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration")
@ConditionalOnClass(BackupQueue.class)
@EnableConfigurationProperties(BackborkProperties.class)
@ConditionalOnProperty(prefix = "backbork", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BackborkConfig {

    @Bean
    @ConditionalOnMissingBean(name = "backborkClock")
    public Clock backborkClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessLiveness processLiveness() {
        return ProcessLiveness.processHandles();
    }

    @Bean
    @ConditionalOnMissingBean
    public DestinationRegistry destinationRegistry(BackborkProperties props) {
        return new ConfiguredDestinationRegistry(props.getDestinations());
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditSink auditSink() {
        return new LoggingAuditSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueLock queueLock(BackborkStores stores, ProcessLiveness liveness, Clock backborkClock,
                               BackborkProperties props) {
        return QueueLock.forCurrentProcess(stores.lock(), liveness, backborkClock, props);
    }

    @Bean
    @ConditionalOnMissingBean
    public BackupQueue backupQueue(BackborkProperties props, BackborkStores stores, DestinationRegistry destinations,
                                   AuditSink auditSink, QueueLock queueLock, Clock backborkClock) {
        return new DefaultBackupQueue(props, stores, destinations, auditSink, queueLock, backborkClock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({ExecutionEngine.class, Transport.class, AccessResolver.class})
    public QueueProcessor queueProcessor(BackborkProperties props, BackborkStores stores, ExecutionEngine engine,
                                         Transport transport, AccessResolver accessResolver,
                                         DestinationRegistry destinations, AuditSink auditSink,
                                         QueueLock queueLock, Clock backborkClock) {
        return new QueueProcessor(props, stores, engine, transport, accessResolver, destinations, auditSink,
                queueLock, backborkClock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({ExecutionEngine.class, Transport.class, AccessResolver.class})
    @ConditionalOnProperty(prefix = "backbork.trigger", name = "enabled", havingValue = "true")
    public QueuePassLifecycle queuePassLifecycle(QueueProcessor queueProcessor, BackupQueue backupQueue,
                                                 BackborkProperties props) {
        return new QueuePassLifecycle(queueProcessor, backupQueue, props);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "backbork", name = "storage", havingValue = "file", matchIfMissing = true)
    static class FileStorageConfig {

        @Bean
        @ConditionalOnMissingBean
        public BackborkStores backborkStores(BackborkProperties props) {
            return FileStores.open(props.getBaseDir());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = {
            "org.springframework.data.mongodb.core.MongoTemplate",
            "io.backbork.internal.mongo.MongoStores"
    })
    @ConditionalOnProperty(prefix = "backbork", name = "storage", havingValue = "mongo")
    static class MongoStorageConfig {

        @Bean
        @ConditionalOnMissingBean
        public BackborkStores backborkStores(MongoTemplate mongoTemplate) {
            return MongoStores.open(mongoTemplate);
        }

        @Bean
        @ConditionalOnMissingBean
        public BackborkMongoIndexConfig backborkMongoIndexConfig(MongoTemplate mongoTemplate) {
            return new BackborkMongoIndexConfig(mongoTemplate);
        }

        @Bean
        @ConditionalOnProperty(prefix = "backbork", name = "ensure-indexes-on-startup", havingValue = "true")
        public SmartInitializingSingleton backborkIndexesInitializer(BackborkMongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }
}
