package dao.tron.twallet.model;

/**
 * Compiled contract as produced by solc, Hardhat or TronBox: ABI JSON and creation bytecode (hex, no 0x).
 */
public record ContractArtifact(String contractName, String abi, String bytecode) {
}
