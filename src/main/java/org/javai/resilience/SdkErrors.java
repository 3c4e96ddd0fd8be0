package org.javai.resilience;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Optional;
import java.util.Set;

/**
 * The catalogue of sentinel errors, and helpers for working with error chains.
 *
 * <p>Every sentinel is registered in the process-wide {@link ErrorRegistry} as this class
 * is initialized. Lookups go through {@link #fromCode}, which initializes this class
 * first, so a code can never be resolved before the catalogue is complete.
 *
 * <p>Sentinels are shared instances. Use {@link SdkException#wrap(Throwable)} or
 * {@link SdkException#withMessage(String)} to add context; compare with
 * {@link #is(Throwable, SdkException)}.
 */
public final class SdkErrors {

    private static final ErrorRegistry REGISTRY = new ErrorRegistry("gen_general_failure", "general failure");

    // General
    public static final SdkException GENERAL_FAILURE = REGISTRY.fallback();
    public static final SdkException NIL_CONTEXT = REGISTRY.register("gen_nil_context", "nil context", null);

    // Cluster operations
    public static final SdkException K8S_RECONCILIATION_FAILED = REGISTRY.register("k8s_reconciliation_failed", "reconciliation failed", null);

    // API/HTTP
    public static final SdkException API_BAD_REQUEST = REGISTRY.register("api_bad_request", "bad request", null);
    public static final SdkException API_EMPTY_PAYLOAD = REGISTRY.register("api_empty_payload", "empty payload", null);
    public static final SdkException API_FOUND = REGISTRY.register("api_found", "found", null);
    public static final SdkException API_INTERNAL = REGISTRY.register("api_internal_error", "internal error", null);
    public static final SdkException API_NOT_FOUND = REGISTRY.register("api_not_found", "not found", null);
    public static final SdkException API_POST_FAILED = REGISTRY.register("api_post_failed", "post failed", null);
    public static final SdkException API_RESPONSE_CODE_INVALID = REGISTRY.register("api_response_code_invalid", "invalid API response code", null);
    public static final SdkException API_SERVER_FAULT = REGISTRY.register("api_server_fault", "server fault", null);
    public static final SdkException API_SUCCESS = REGISTRY.register("api_success", "success", null);

    // Entity
    public static final SdkException ENTITY_DELETED = REGISTRY.register("entity_deleted", "entity marked as deleted", null);
    public static final SdkException ENTITY_EXISTS = REGISTRY.register("entity_exists", "entity already exists", null);
    public static final SdkException ENTITY_INVALID = REGISTRY.register("entity_invalid", "entity is invalid", null);
    public static final SdkException ENTITY_LOAD_FAILED = REGISTRY.register("entity_load_failed", "failed to load entity", null);
    public static final SdkException ENTITY_NOT_FOUND = REGISTRY.register("entity_not_found", "entity not found", null);
    public static final SdkException ENTITY_QUERY_FAILED = REGISTRY.register("entity_query_failed", "failed to query entities", null);
    public static final SdkException ENTITY_SAVE_FAILED = REGISTRY.register("entity_save_failed", "failed to save entity", null);
    public static final SdkException ENTITY_VERSION_INVALID = REGISTRY.register("entity_version_invalid", "invalid version", null);
    public static final SdkException ENTITY_VERSION_NOT_FOUND = REGISTRY.register("entity_version_not_found", "version not found", null);

    // State
    public static final SdkException STATE_ALREADY_INITIALIZED = REGISTRY.register("state_already_initialized", "already initialized", null);
    public static final SdkException STATE_INITIALIZATION_FAILED = REGISTRY.register("state_initialization_failed", "initialization failed", null);
    public static final SdkException STATE_NOT_ALIVE = REGISTRY.register("state_not_alive", "not alive", null);
    public static final SdkException STATE_NOT_READY = REGISTRY.register("state_not_ready", "not ready", null);

    // Access control
    public static final SdkException ACCESS_INVALID_PERMISSION = REGISTRY.register("access_invalid_permission", "invalid permission", null);
    public static final SdkException ACCESS_UNAUTHORIZED = REGISTRY.register("access_unauthorized", "unauthorized", null);

    // Object lifecycle
    public static final SdkException OBJECT_CREATION_FAILED = REGISTRY.register("object_creation_failed", "creation failed", null);
    public static final SdkException OBJECT_DELETION_FAILED = REGISTRY.register("object_deletion_failed", "deletion failed", null);
    public static final SdkException OBJECT_DELETION_SUCCESS = REGISTRY.register("object_deletion_success", "deletion success", null);
    public static final SdkException OBJECT_UNDELETION_FAILED = REGISTRY.register("object_undeletion_failed", "undeletion failed", null);
    public static final SdkException OBJECT_UNDELETION_SUCCESS = REGISTRY.register("object_undeletion_success", "undeletion success", null);

    // Root key management
    public static final SdkException ROOT_KEY_EMPTY = REGISTRY.register("root_key_empty", "root key empty", null);
    public static final SdkException ROOT_KEY_MISSING = REGISTRY.register("root_key_missing", "root key missing", null);
    public static final SdkException ROOT_KEY_NOT_EMPTY = REGISTRY.register("root_key_not_empty", "root key not empty", null);
    public static final SdkException ROOT_KEY_SET_SUCCESS = REGISTRY.register("root_key_set_success", "root key set success", null);
    public static final SdkException ROOT_KEY_SKIP_CREATION_FOR_IN_MEMORY_MODE = REGISTRY.register("root_key_skip_creation_for_in_memory_mode", "root key skip creation for in memory mode", null);
    public static final SdkException ROOT_KEY_UPDATE_SKIPPED_KEY_EMPTY = REGISTRY.register("root_key_update_skipped_key_empty", "root key update skipped key empty", null);

    // Shamir secret sharing
    public static final SdkException SHAMIR_DUPLICATE_INDEX = REGISTRY.register("shamir_duplicate_index", "shamir duplicate index", null);
    public static final SdkException SHAMIR_EMPTY_SHARD = REGISTRY.register("shamir_empty_shard", "shamir empty shard", null);
    public static final SdkException SHAMIR_INVALID_INDEX = REGISTRY.register("shamir_invalid_index", "shamir invalid index", null);
    public static final SdkException SHAMIR_NIL_SHARD = REGISTRY.register("shamir_nil_shard", "shamir nil shard", null);
    public static final SdkException SHAMIR_NOT_ENOUGH_SHARDS = REGISTRY.register("shamir_not_enough_shards", "shamir not enough shards", null);
    public static final SdkException SHAMIR_RECONSTRUCTION_FAILED = REGISTRY.register("shamir_reconstruction_failed", "shamir reconstruction failed", null);

    // Crypto
    public static final SdkException CRYPTO_CIPHER_NOT_AVAILABLE = REGISTRY.register("crypto_cipher_not_available", "cipher not available", null);
    public static final SdkException CRYPTO_CIPHER_VERIFICATION_FAILED = REGISTRY.register("crypto_cipher_verification_failed", "cipher verification failed", null);
    public static final SdkException CRYPTO_CIPHER_VERIFICATION_SUCCESS = REGISTRY.register("crypto_cipher_verification_success", "cipher verification success", null);
    public static final SdkException CRYPTO_DECRYPTION_FAILED = REGISTRY.register("crypto_decryption_failed", "decryption failed", null);
    public static final SdkException CRYPTO_ENCRYPTION_FAILED = REGISTRY.register("crypto_encryption_failed", "encryption failed", null);
    public static final SdkException CRYPTO_FAILED_TO_CREATE_CIPHER = REGISTRY.register("crypto_failed_to_create_cipher", "failed to create cipher", null);
    public static final SdkException CRYPTO_FAILED_TO_CREATE_GCM = REGISTRY.register("crypto_failed_to_create_gcm", "failed to create GCM", null);
    public static final SdkException CRYPTO_FAILED_TO_READ_NONCE = REGISTRY.register("crypto_failed_to_read_nonce", "failed to read nonce", null);
    public static final SdkException CRYPTO_FAILED_TO_READ_VERSION = REGISTRY.register("crypto_failed_to_read_version", "failed to read version", null);
    public static final SdkException CRYPTO_INVALID_ENCRYPTION_KEY_LENGTH = REGISTRY.register("crypto_invalid_encryption_key_length", "invalid encryption key length", null);
    public static final SdkException CRYPTO_LOW_ENTROPY = REGISTRY.register("crypto_low_entropy", "low entropy", null);
    public static final SdkException CRYPTO_NONCE_GENERATION_FAILED = REGISTRY.register("crypto_nonce_generation_failed", "nonce generation failed", null);
    public static final SdkException CRYPTO_RANDOM_GENERATION_FAILED = REGISTRY.register("crypto_random_generation_failed", "random generation failed", null);

    // Backing store
    public static final SdkException STORE_INVALID_CONFIGURATION = REGISTRY.register("store_invalid_configuration", "invalid store configuration", null);
    public static final SdkException STORE_INVALID_ENCRYPTION_KEY = REGISTRY.register("store_invalid_encryption_key", "invalid store encryption key", null);
    public static final SdkException STORE_RESULT_SET_FAILED_TO_LOAD = REGISTRY.register("store_result_set_failed_to_load", "result set failed to load", null);

    // Filesystem
    public static final SdkException FS_DIRECTORY_CREATION_FAILED = REGISTRY.register("fs_directory_creation_failed", "directory creation failed", null);
    public static final SdkException FS_FAILED_TO_CHECK_DIRECTORY = REGISTRY.register("fs_failed_to_check_directory", "failed to check directory", null);
    public static final SdkException FS_FAILED_TO_CREATE_DIRECTORY = REGISTRY.register("fs_failed_to_create_directory", "failed to create directory", null);
    public static final SdkException FS_FAILED_TO_RESOLVE_PATH = REGISTRY.register("fs_failed_to_resolve_path", "failed to resolve filesystem path", null);
    public static final SdkException FS_FILE_CLOSE_FAILED = REGISTRY.register("fs_file_close_failed", "file close failed", null);
    public static final SdkException FS_FILE_IS_NOT_A_DIRECTORY = REGISTRY.register("fs_file_is_not_a_directory", "file is not a directory", null);
    public static final SdkException FS_FILE_OPEN_FAILED = REGISTRY.register("fs_file_open_failed", "file open failed", null);
    public static final SdkException FS_INVALID_DIRECTORY = REGISTRY.register("fs_invalid_directory", "invalid directory", null);
    public static final SdkException FS_PARENT_DIRECTORY_DOES_NOT_EXIST = REGISTRY.register("fs_parent_directory_does_not_exist", "parent directory does not exist", null);
    public static final SdkException FS_PATH_CANNOT_BE_EMPTY = REGISTRY.register("fs_path_cannot_be_empty", "filesystem path cannot be empty", null);
    public static final SdkException FS_PATH_RESTRICTED = REGISTRY.register("fs_path_restricted", "filesystem path is restricted for security reasons", null);
    public static final SdkException FS_STREAM_CLOSE_FAILED = REGISTRY.register("fs_stream_close_failed", "stream close failed", null);
    public static final SdkException FS_STREAM_OPEN_FAILED = REGISTRY.register("fs_stream_open_failed", "stream open failed", null);

    // Data processing
    public static final SdkException DATA_INVALID_INPUT = REGISTRY.register("data_invalid_input", "invalid input", null);
    public static final SdkException DATA_MARSHAL_FAILURE = REGISTRY.register("data_marshal_failure", "failed to marshal response body", null);
    public static final SdkException DATA_PARSE_FAILURE = REGISTRY.register("data_parse_failure", "failed to parse request body", null);
    public static final SdkException DATA_READ_FAILURE = REGISTRY.register("data_read_failure", "failed to read request body", null);
    public static final SdkException DATA_UNMARSHAL_FAILURE = REGISTRY.register("data_unmarshal_failure", "failed to unmarshal request body", null);

    // String templates
    public static final SdkException STRING_EMPTY_CHARACTER_CLASS = REGISTRY.register("string_empty_character_class", "empty character class", null);
    public static final SdkException STRING_INVALID_RANGE = REGISTRY.register("string_invalid_range", "invalid character range", null);
    public static final SdkException STRING_EMPTY_CHARACTER_SET = REGISTRY.register("string_empty_character_set", "character class resulted in empty set", null);
    public static final SdkException STRING_INVALID_LENGTH = REGISTRY.register("string_invalid_length", "invalid length specification", null);
    public static final SdkException STRING_NEGATIVE_LENGTH = REGISTRY.register("string_negative_length", "length cannot be negative", null);

    // Network
    public static final SdkException NET_PEER_CONNECTION = REGISTRY.register("net_peer_connection", "problem connecting to peer", null);
    public static final SdkException NET_READING_REQUEST_BODY = REGISTRY.register("net_reading_request_body", "problem reading request body", null);
    public static final SdkException NET_READING_RESPONSE_BODY = REGISTRY.register("net_reading_response_body", "problem reading response body", null);
    public static final SdkException NET_URL_JOIN_PATH_FAILED = REGISTRY.register("net_url_join_path_failed", "failed to join URL path", null);

    // Transactions
    public static final SdkException TRANSACTION_BEGIN_FAILED = REGISTRY.register("transaction_begin_failed", "failed to begin transaction", null);
    public static final SdkException TRANSACTION_COMMIT_FAILED = REGISTRY.register("transaction_commit_failed", "failed to commit transaction", null);
    public static final SdkException TRANSACTION_FAILED = REGISTRY.register("transaction_failed", "transaction failed", null);
    public static final SdkException TRANSACTION_ROLLBACK_FAILED = REGISTRY.register("transaction_rollback_failed", "failed to rollback transaction", null);

    // Recovery
    public static final SdkException RECOVERY_RETRY_FAILED = REGISTRY.register("recovery_retry_failed", "recovery retry failed", null);
    public static final SdkException RECOVERY_RETRY_LIMIT_REACHED = REGISTRY.register("recovery_retry_limit_reached", "recovery retry limit reached", null);
    public static final SdkException RECOVERY_FAILED = REGISTRY.register("recovery_failed", "recovery failed", null);

    // Retry
    public static final SdkException RETRY_MAX_ELAPSED_TIME_REACHED = REGISTRY.register("retry_max_elapsed_time_reached", "maximum elapsed time for retries reached", null);
    public static final SdkException RETRY_CONTEXT_CANCELED = REGISTRY.register("retry_context_canceled", "retry canceled due to context cancellation", null);
    public static final SdkException RETRY_OPERATION_FAILED = REGISTRY.register("retry_operation_failed", "retry operation failed", null);
    public static final SdkException RETRY_MAX_ATTEMPTS_REACHED = REGISTRY.register("retry_max_attempts_reached", "maximum number of retry attempts reached", null);

    // X509/SPIFFE
    public static final SdkException SPIFFE_EMPTY_TRUST_DOMAIN = REGISTRY.register("spiffe_empty_trust_domain", "empty trust domain", null);
    public static final SdkException SPIFFE_FAILED_TO_CREATE_X509_SOURCE = REGISTRY.register("spiffe_failed_to_create_x509_source", "failed to create X509Source", null);
    public static final SdkException SPIFFE_FAILED_TO_EXTRACT_X509_SVID = REGISTRY.register("spiffe_failed_to_extract_x509_svid", "failed to extract X509 SVID", null);
    public static final SdkException SPIFFE_MULTIPLE_TRUST_DOMAINS = REGISTRY.register("spiffe_multiple_trust_domains", "provide a single trust domain", null);
    public static final SdkException SPIFFE_NIL_X509_SOURCE = REGISTRY.register("spiffe_nil_x509_source", "nil X509Source", null);
    public static final SdkException SPIFFE_NO_PEER_CERTIFICATES = REGISTRY.register("spiffe_no_peer_certificates", "no peer certificates", null);
    public static final SdkException SPIFFE_UNABLE_TO_FETCH_X509_SOURCE = REGISTRY.register("spiffe_unable_to_fetch_x509_source", "unable to fetch X509Source", null);
    public static final SdkException SPIFFE_FAILED_TO_CLOSE_X509_SOURCE = REGISTRY.register("spiffe_failed_to_close_source", "failed to close X509Source", null);

    private SdkErrors() {
        // Constants and static helpers only
    }

    /**
     * Returns the process-wide registry backing {@link #fromCode}.
     */
    public static ErrorRegistry registry() {
        return REGISTRY;
    }

    /**
     * Maps a code received from a remote peer back to its sentinel error.
     * Unknown codes resolve to {@link #GENERAL_FAILURE}.
     */
    public static SdkException fromCode(ErrorCode code) {
        return REGISTRY.fromCode(code);
    }

    /**
     * Maps a code string received from a remote peer back to its sentinel error.
     * Unknown, null or blank codes resolve to {@link #GENERAL_FAILURE}.
     */
    public static SdkException fromCode(String code) {
        return REGISTRY.fromCode(code);
    }

    /**
     * Reports whether {@code error} or any throwable on its cause chain is an
     * {@link SdkException} with the same code as {@code target}.
     *
     * @param error the error to inspect (may be null)
     * @param target the sentinel to compare against
     * @return true if a matching code is found on the chain
     */
    public static boolean is(Throwable error, SdkException target) {
        if (error == null || target == null) {
            return false;
        }
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable current = error; current != null && seen.add(current); current = current.getCause()) {
            if (current instanceof SdkException sdkException && sdkException.hasCode(target.code())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the first {@link SdkException} on the cause chain of {@code error}.
     */
    public static Optional<SdkException> find(Throwable error) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable current = error; current != null && seen.add(current); current = current.getCause()) {
            if (current instanceof SdkException sdkException) {
                return Optional.of(sdkException);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the string form of an error, or an empty string if there is none.
     */
    public static String messageOf(Throwable error) {
        return error != null ? error.toString() : "";
    }
}
