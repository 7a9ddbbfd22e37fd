package com.gaslessmint.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.springframework.data.mongodb.core.query.Criteria.where;

@RequiredArgsConstructor
public class UserRepositoryImpl implements UserRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public User findOrCreateByEmail(String email) {
        Instant now = Instant.now();
        Query query = new Query(where("email").is(email));
        Update update = new Update()
                .setOnInsert("_id", UUID.randomUUID().toString())
                .setOnInsert("createdAt", now)
                .setOnInsert("updatedAt", now);
        try {
            return mongoTemplate.findAndModify(query, update,
                    FindAndModifyOptions.options().upsert(true).returnNew(true), User.class);
        } catch (DuplicateKeyException e) {
            // concurrent upsert on the unique email index; the other insert won
            return mongoTemplate.findOne(query, User.class);
        }
    }

    @Override
    public Optional<User> attachWalletIfAbsent(String userId, Wallet wallet) {
        Query query = new Query(where("_id").is(userId).and("walletId").is(null));
        Update update = new Update()
                .set("walletId", wallet.id())
                .set("walletAddress", wallet.address())
                .set("walletBlockchain", wallet.blockchain())
                .set("walletAccountType", wallet.accountType())
                .set("updatedAt", Instant.now());
        User updated = mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), User.class);
        if (updated != null) {
            return Optional.of(updated);
        }
        return Optional.ofNullable(mongoTemplate.findById(userId, User.class));
    }
}
